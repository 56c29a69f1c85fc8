package com.assettrack.setracker.exception;

/**
 * Base exception for frames rejected before they reach the dispatcher.
 * Carries the validation type that failed and a short fragment of the
 * offending frame for the logs.
 */
public class ValidationException extends Exception {
    public static final String PROTOCOL = "SETRACKER";
    private static final int MAX_FRAGMENT_LENGTH = 32;

    private final String validationType;
    private final String payloadFragment;

    /**
     * Constructs a protocol-specific validation exception
     * @param validationType The type of validation that failed (e.g. "FORMAT", "LENGTH")
     * @param message The detail message
     * @param payload The rejected frame, truncated for diagnostics
     */
    public ValidationException(String validationType, String message, String payload) {
        super(String.format("[%s:%s] %s", PROTOCOL, validationType, message));
        this.validationType = validationType;
        this.payloadFragment = payload == null ? ""
                : payload.substring(0, Math.min(payload.length(), MAX_FRAGMENT_LENGTH));
    }

    /**
     * @return The type of validation that failed
     */
    public String getValidationType() {
        return validationType;
    }

    /**
     * @return Leading part of the rejected frame (at most 32 characters)
     */
    public String getPayloadFragment() {
        return payloadFragment;
    }
}
