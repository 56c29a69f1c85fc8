package com.assettrack.setracker.protocol.extractor;

import com.assettrack.setracker.model.SeTrackerMessage;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Extracts remote-snapshot data from {@code img,5,<time>,<data...>} frames.
 * Other sub-types are ignored.
 */
@Component
public class ImageExtractor {
    static final String SNAPSHOT_SUBTYPE = "5";
    static final int MIN_FIELDS = 3;
    static final int SUBTYPE_INDEX = 1;
    static final int TIME_INDEX = 2;
    static final int DATA_INDEX = 3;

    public Optional<SnapshotImage> extract(SeTrackerMessage message) {
        ContentFields fields = ContentFields.of(message.getContent());
        if (fields.size() < MIN_FIELDS
                || !SNAPSHOT_SUBTYPE.equals(fields.get(SUBTYPE_INDEX).orElse(null))) {
            return Optional.empty();
        }
        // image data may itself contain commas
        return Optional.of(new SnapshotImage(
                fields.get(TIME_INDEX).orElse(""),
                fields.joinFrom(DATA_INDEX)));
    }
}
