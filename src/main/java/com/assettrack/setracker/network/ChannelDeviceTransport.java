package com.assettrack.setracker.network;

import com.assettrack.setracker.session.DeviceSession;
import com.assettrack.setracker.session.SessionManager;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Sends frames over the Netty channel registered for the device. The pipeline's
 * line encoder appends CRLF.
 */
@Component
public class ChannelDeviceTransport implements DeviceTransport {
    private static final Logger logger = LoggerFactory.getLogger(ChannelDeviceTransport.class);
    private static final Logger trafficLogger = LoggerFactory.getLogger("TRAFFIC");

    private final SessionManager sessionManager;

    public ChannelDeviceTransport(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public boolean send(String deviceId, String frame) {
        Optional<DeviceSession> session = sessionManager.getSession(deviceId);
        if (session.isEmpty() || !session.get().isConnected()) {
            logger.warn("Device {} is not connected, dropping {}", deviceId, frame);
            return false;
        }

        Channel channel = session.get().getChannel();
        channel.writeAndFlush(frame).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                trafficLogger.info("OUT {} {}", deviceId, frame);
            } else {
                logger.warn("Failed to deliver {} to device {}", frame, deviceId, future.cause());
            }
        });
        return true;
    }
}
