package com.assettrack.setracker.protocol.extractor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Positional access to the comma-separated fields of a frame's content.
 * Missing or unparsable fields come back empty; nothing here throws.
 */
public final class ContentFields {
    private static final String SEPARATOR = ",";

    private final String[] parts;

    private ContentFields(String[] parts) {
        this.parts = parts;
    }

    public static ContentFields of(String content) {
        // keep trailing empty fields, devices send runs of ",,,"
        return new ContentFields(content.split(SEPARATOR, -1));
    }

    public int size() {
        return parts.length;
    }

    public Optional<String> get(int index) {
        if (index < 0 || index >= parts.length) {
            return Optional.empty();
        }
        return Optional.of(parts[index]);
    }

    public Optional<Double> getDouble(int index) {
        return get(index).flatMap(ContentFields::toDouble);
    }

    public Optional<Integer> getInteger(int index) {
        return get(index).flatMap(ContentFields::toInteger);
    }

    /**
     * Fields from {@code fromIndex} to the end, re-joined with commas.
     */
    public String joinFrom(int fromIndex) {
        if (fromIndex >= parts.length) {
            return "";
        }
        return String.join(SEPARATOR, Arrays.copyOfRange(parts, fromIndex, parts.length));
    }

    private static Optional<Double> toDouble(String value) {
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Integer> toInteger(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
