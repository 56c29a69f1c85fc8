package com.assettrack.setracker.session;

import io.netty.channel.Channel;

/**
 * Live connection of one device, used to route server-initiated commands.
 */
public class DeviceSession {
    private final String deviceId;
    private volatile String manufacturer;
    private volatile Channel channel;

    public DeviceSession(String deviceId, String manufacturer, Channel channel) {
        if (deviceId == null || deviceId.trim().isEmpty()) {
            throw new IllegalArgumentException("Device ID cannot be null or empty");
        }
        this.deviceId = deviceId;
        this.manufacturer = manufacturer;
        this.channel = channel;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getManufacturer() {
        return manufacturer;
    }

    public Channel getChannel() {
        return channel;
    }

    public boolean isConnected() {
        Channel current = channel;
        return current != null && current.isActive();
    }

    synchronized void attach(String manufacturer, Channel channel) {
        this.manufacturer = manufacturer;
        this.channel = channel;
    }

    @Override
    public String toString() {
        return "DeviceSession{" +
                "deviceId='" + deviceId + '\'' +
                ", manufacturer='" + manufacturer + '\'' +
                ", remoteAddress=" + (channel != null ? channel.remoteAddress() : null) +
                ", connected=" + isConnected() +
                '}';
    }
}
