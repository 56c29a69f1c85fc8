package com.assettrack.setracker.protocol;

import com.assettrack.setracker.exception.FrameFormatException;
import com.assettrack.setracker.exception.LengthMismatchException;
import com.assettrack.setracker.model.SeTrackerMessage;
import org.springframework.stereotype.Component;

/**
 * Parses {@code [manufacturer*deviceId*length*content]} frames, e.g.
 * {@code [3G*8800000015*000D*LK,50,100,100]}.
 *
 * The length field is read as decimal first and as hexadecimal only when
 * that fails, so {@code 0012} means twelve characters and {@code 000D} means
 * thirteen. Length is compared against the character count of the content.
 */
@Component
public class SeTrackerMessageParser {
    private static final char FRAME_START = '[';
    private static final char FRAME_END = ']';
    private static final String FIELD_SEPARATOR = "\\*";
    private static final int FIELD_COUNT = 4;

    public SeTrackerMessage parse(String raw) throws FrameFormatException, LengthMismatchException {
        if (raw == null || raw.length() < 2
                || raw.charAt(0) != FRAME_START || raw.charAt(raw.length() - 1) != FRAME_END) {
            throw new FrameFormatException("Frame must be enclosed in brackets", raw);
        }

        String body = raw.substring(1, raw.length() - 1);
        String[] parts = body.split(FIELD_SEPARATOR, -1);
        if (parts.length != FIELD_COUNT) {
            throw new FrameFormatException(
                    "Expected " + FIELD_COUNT + " '*'-separated fields but found " + parts.length, raw);
        }

        String manufacturer = parts[0];
        String deviceId = parts[1];
        int length = parseLength(parts[2], raw);
        String content = parts[3];

        if (content.length() != length) {
            throw new LengthMismatchException(length, content.length(), raw);
        }
        return new SeTrackerMessage(manufacturer, deviceId, length, content);
    }

    private int parseLength(String field, String raw) throws FrameFormatException {
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException decimal) {
            try {
                return Integer.parseInt(field, 16);
            } catch (NumberFormatException hex) {
                throw new FrameFormatException("Invalid length field: " + field, raw);
            }
        }
    }
}
