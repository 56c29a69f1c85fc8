package com.assettrack.setracker.exception;

/**
 * Frame does not have the {@code [manufacturer*deviceId*length*content]} shape,
 * or its length field is neither decimal nor hexadecimal.
 */
public class FrameFormatException extends ValidationException {
    public static final String TYPE = "FORMAT";

    public FrameFormatException(String message, String payload) {
        super(TYPE, message, payload);
    }
}
