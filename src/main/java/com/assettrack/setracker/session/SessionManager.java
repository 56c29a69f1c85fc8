package com.assettrack.setracker.session;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of connected devices, keyed by device id and by channel. Populated
 * when a device sends its first valid frame on a connection.
 */
@Component
public class SessionManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, DeviceSession> sessionsByDeviceId = new ConcurrentHashMap<>();
    private final Map<Channel, String> deviceIdsByChannel = new ConcurrentHashMap<>();

    /**
     * Binds the device to the channel, replacing any previous connection of the same device.
     */
    public DeviceSession register(String deviceId, String manufacturer, Channel channel) {
        DeviceSession session = sessionsByDeviceId.compute(deviceId, (id, existing) -> {
            if (existing == null) {
                logger.info("Created new session for device {} from {}", id, channel.remoteAddress());
                return new DeviceSession(id, manufacturer, channel);
            }
            if (existing.getChannel() != channel) {
                Channel previous = existing.getChannel();
                if (previous != null) {
                    deviceIdsByChannel.remove(previous);
                }
                logger.info("Device {} reconnected from {}", id, channel.remoteAddress());
                existing.attach(manufacturer, channel);
            }
            return existing;
        });
        deviceIdsByChannel.put(channel, deviceId);
        return session;
    }

    public Optional<DeviceSession> getSession(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionsByDeviceId.get(deviceId));
    }

    public Optional<DeviceSession> getSessionByChannel(Channel channel) {
        String deviceId = deviceIdsByChannel.get(channel);
        return deviceId == null ? Optional.empty() : getSession(deviceId);
    }

    /**
     * Drops the session bound to a closed channel. A session that has since
     * moved to a newer channel is left alone.
     */
    public void unregister(Channel channel) {
        String deviceId = deviceIdsByChannel.remove(channel);
        if (deviceId == null) {
            return;
        }
        sessionsByDeviceId.computeIfPresent(deviceId, (id, session) -> {
            if (session.getChannel() == channel) {
                logger.info("Removed session for device {}", id);
                return null;
            }
            return session;
        });
    }

    @Scheduled(fixedRate = 60000)
    public void cleanupInactiveSessions() {
        sessionsByDeviceId.values().removeIf(session -> {
            if (!session.isConnected()) {
                Channel channel = session.getChannel();
                if (channel != null) {
                    deviceIdsByChannel.remove(channel);
                }
                logger.debug("Cleaned up inactive session for device {}", session.getDeviceId());
                return true;
            }
            return false;
        });
    }

    public int getActiveSessionCount() {
        return sessionsByDeviceId.size();
    }
}
