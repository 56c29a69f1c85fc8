package com.assettrack.setracker.network;

/**
 * Writes frames to connected devices.
 */
public interface DeviceTransport {

    /**
     * Queues a frame for the device's live connection. Delivery is not confirmed.
     *
     * @param deviceId target device
     * @param frame complete frame, without line terminator
     * @return {@code false} when the device has no live connection
     */
    boolean send(String deviceId, String frame);
}
