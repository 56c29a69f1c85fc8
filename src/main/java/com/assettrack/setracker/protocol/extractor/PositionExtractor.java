package com.assettrack.setracker.protocol.extractor;

import com.assettrack.setracker.model.SeTrackerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads latitude, longitude, signal strength and battery level from a position
 * report such as {@code UD,220414,134652,A,22.571707,N,113.8613968,E,...}.
 *
 * This device profile takes latitude from field 3 and longitude from field 5;
 * fields 1, 2 and 4 are not read.
 */
@Component
public class PositionExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PositionExtractor.class);

    static final int MIN_FIELDS = 5;
    static final int TYPE_INDEX = 0;
    static final int LATITUDE_INDEX = 3;
    static final int LONGITUDE_INDEX = 5;
    static final int SIGNAL_INDEX = 11;
    static final int BATTERY_INDEX = 12;

    /**
     * @return the extracted fix, or empty when the content has fewer than five fields
     */
    public Optional<PositionFix> extract(SeTrackerMessage message) {
        ContentFields fields = ContentFields.of(message.getContent());
        if (fields.size() < MIN_FIELDS) {
            logger.debug("Position report from {} too short ({} fields), skipping extraction",
                    message.getDeviceId(), fields.size());
            return Optional.empty();
        }

        PositionFix fix = new PositionFix(
                fields.get(TYPE_INDEX).orElse(message.getToken()),
                fields.getDouble(LATITUDE_INDEX).orElse(null),
                fields.getDouble(LONGITUDE_INDEX).orElse(null),
                fields.getInteger(SIGNAL_INDEX).orElse(null),
                fields.getInteger(BATTERY_INDEX).orElse(null));
        logger.debug("Extracted {} for device {}", fix, message.getDeviceId());
        return Optional.of(fix);
    }
}
