package com.assettrack.setracker.protocol.extractor;

import com.assettrack.setracker.model.SeTrackerMessage;
import org.springframework.stereotype.Component;

/**
 * Decodes the hexadecimal alarm word carried in field 15 of an AL frame.
 *
 * The word is rendered as a 32-character binary string and the flags are read
 * by string position: index 11 is fall-down, index 16 is SOS. When the field is
 * missing or not hex the fallback string is only eight characters long, so both
 * positions are out of range and read as {@code false}.
 */
@Component
public class AlarmExtractor {
    static final int ALARM_WORD_INDEX = 15;
    static final int WORD_WIDTH = 32;
    static final String DEFAULT_BITS = "00000000";
    static final int FALL_DOWN_BIT = 11;
    static final int SOS_BIT = 16;

    public AlarmStatus extract(SeTrackerMessage message) {
        String bits = ContentFields.of(message.getContent())
                .get(ALARM_WORD_INDEX)
                .map(AlarmExtractor::toBinary)
                .orElse(DEFAULT_BITS);
        return new AlarmStatus(bits, isSet(bits, FALL_DOWN_BIT), isSet(bits, SOS_BIT));
    }

    static String toBinary(String hex) {
        try {
            int word = Integer.parseUnsignedInt(hex.trim(), 16);
            String binary = Integer.toBinaryString(word);
            StringBuilder padded = new StringBuilder(WORD_WIDTH);
            for (int i = binary.length(); i < WORD_WIDTH; i++) {
                padded.append('0');
            }
            return padded.append(binary).toString();
        } catch (NumberFormatException e) {
            return DEFAULT_BITS;
        }
    }

    private static boolean isSet(String bits, int index) {
        return index < bits.length() && bits.charAt(index) == '1';
    }
}
