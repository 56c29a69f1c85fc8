package com.assettrack.setracker.protocol;

import com.assettrack.setracker.model.CommandRecord;
import com.assettrack.setracker.model.SeTrackerMessage;
import com.assettrack.setracker.protocol.extractor.AlarmExtractor;
import com.assettrack.setracker.protocol.extractor.AlarmStatus;
import com.assettrack.setracker.protocol.extractor.ImageExtractor;
import com.assettrack.setracker.protocol.extractor.PositionExtractor;
import com.assettrack.setracker.protocol.extractor.PositionFix;
import com.assettrack.setracker.protocol.extractor.SnapshotImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a parsed frame by its command token and decides what to reply
 * and what to store. Stateless; safe to share between connections.
 */
@Component
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String CONFIG_REPLY_BODY = "CONFIG,1";

    private final SeTrackerResponseFormatter formatter;
    private final PositionExtractor positionExtractor;
    private final AlarmExtractor alarmExtractor;
    private final ImageExtractor imageExtractor;
    private final Clock clock;

    @Autowired
    public CommandDispatcher(SeTrackerResponseFormatter formatter,
                             PositionExtractor positionExtractor,
                             AlarmExtractor alarmExtractor,
                             ImageExtractor imageExtractor,
                             Clock clock) {
        this.formatter = formatter;
        this.positionExtractor = positionExtractor;
        this.alarmExtractor = alarmExtractor;
        this.imageExtractor = imageExtractor;
        this.clock = clock;
    }

    public DispatchResult dispatch(SeTrackerMessage message) {
        String token = message.getToken();
        CommandType type = CommandType.fromToken(token);
        LocalDateTime receivedAt = LocalDateTime.now(clock);

        List<CommandRecord> records = new ArrayList<>(2);
        records.add(new CommandRecord(message.getDeviceId(), token, message.getContent(), receivedAt));

        String reply = null;
        switch (type.getCategory()) {
            case HEARTBEAT:
                reply = reply(message, type, type.getToken());
                break;
            case ALARM:
                handleAlarm(message);
                reply = reply(message, type, type.getToken());
                break;
            case POSITION:
                positionExtractor.extract(message)
                        .map(fix -> toPositionRecord(message, fix, receivedAt))
                        .ifPresent(records::add);
                break;
            case CONFIG:
                reply = reply(message, type, CONFIG_REPLY_BODY);
                break;
            case IMAGE:
                imageExtractor.extract(message)
                        .map(image -> toImageRecord(message, image, receivedAt))
                        .ifPresent(records::add);
                break;
            case SERVER_COMMAND:
                logger.info("Device {} acknowledged {}", message.getDeviceId(), type.getToken());
                reply = reply(message, type, type.getToken());
                break;
            case UNKNOWN:
            default:
                logger.warn("Unknown command '{}' from device {}", token, message.getDeviceId());
                break;
        }

        if (reply != null) {
            logger.debug("Generated response: {}", reply);
        }
        return new DispatchResult(type, reply, records);
    }

    private String reply(SeTrackerMessage message, CommandType type, String body) {
        return formatter.format(message.getManufacturer(), message.getDeviceId(), type.getReplyLength(), body);
    }

    private void handleAlarm(SeTrackerMessage message) {
        AlarmStatus status = alarmExtractor.extract(message);
        if (status.isFallDown() || status.isSos()) {
            logger.warn("ALARM from {}: fallDown={}, sos={}",
                    message.getDeviceId(), status.isFallDown(), status.isSos());
        } else {
            logger.info("Alarm report from {}: {}", message.getDeviceId(), status.getBits());
        }
    }

    private CommandRecord toPositionRecord(SeTrackerMessage message, PositionFix fix, LocalDateTime receivedAt) {
        CommandRecord record = new CommandRecord(message.getDeviceId(), fix.getType(), message.getContent(), receivedAt);
        record.setLatitude(fix.getLatitude().orElse(null));
        record.setLongitude(fix.getLongitude().orElse(null));
        record.setSignalStrength(fix.getSignalStrength().orElse(null));
        record.setBatteryLevel(fix.getBatteryLevel().orElse(null));
        return record;
    }

    private CommandRecord toImageRecord(SeTrackerMessage message, SnapshotImage image, LocalDateTime receivedAt) {
        CommandRecord record = new CommandRecord(message.getDeviceId(), message.getToken(), message.getContent(), receivedAt);
        record.setDeviceTime(image.getDeviceTime());
        record.setImageData(image.getImageData());
        logger.info("Snapshot from {} taken at {} ({} chars)",
                message.getDeviceId(), image.getDeviceTime(), image.getImageData().length());
        return record;
    }
}
