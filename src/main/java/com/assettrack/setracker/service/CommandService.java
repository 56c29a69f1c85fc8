package com.assettrack.setracker.service;

import com.assettrack.setracker.model.OutboundCommand;
import com.assettrack.setracker.network.DeviceTransport;
import com.assettrack.setracker.protocol.SeTrackerResponseFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends server-initiated commands (APN, UPLOAD, CR, ...) to devices.
 */
@Service
public class CommandService {
    private static final Logger logger = LoggerFactory.getLogger(CommandService.class);

    private final SeTrackerResponseFormatter formatter;
    private final DeviceTransport deviceTransport;

    public CommandService(SeTrackerResponseFormatter formatter, DeviceTransport deviceTransport) {
        this.formatter = formatter;
        this.deviceTransport = deviceTransport;
    }

    /**
     * Composes {@code [3G*deviceId*LEN*command+content]} and hands it to the transport.
     *
     * @param deviceId target device
     * @param command command token, e.g. {@code APN}
     * @param content extra content appended verbatim, e.g. {@code ,cmnet,,,20634}; may be null
     * @return the composed frame and whether a live connection accepted it
     * @throws IllegalArgumentException on a blank device id or command, or a body too long for the length field
     */
    public CommandDispatch sendCommand(String deviceId, String command, String content) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device ID cannot be empty");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Command cannot be empty");
        }

        // rejects bodies too long for the length field before anything is sent
        String frame = formatter.compose(new OutboundCommand(deviceId, command, content));
        logger.info("Sending command: {}", frame);
        boolean delivered = deviceTransport.send(deviceId, frame);
        return new CommandDispatch(frame, delivered);
    }

    public static final class CommandDispatch {
        private final String frame;
        private final boolean delivered;

        public CommandDispatch(String frame, boolean delivered) {
            this.frame = frame;
            this.delivered = delivered;
        }

        public String getFrame() {
            return frame;
        }

        /**
         * {@code true} when the device was connected and the frame was queued on its channel.
         */
        public boolean isDelivered() {
            return delivered;
        }
    }
}
