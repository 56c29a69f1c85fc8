package com.assettrack.setracker.exception;

/**
 * Declared length field disagrees with the character count of the content.
 */
public class LengthMismatchException extends ValidationException {
    public static final String TYPE = "LENGTH";

    private final int declaredLength;
    private final int actualLength;

    public LengthMismatchException(int declaredLength, int actualLength, String payload) {
        super(TYPE, String.format("Declared length %d but content has %d characters",
                declaredLength, actualLength), payload);
        this.declaredLength = declaredLength;
        this.actualLength = actualLength;
    }

    public int getDeclaredLength() {
        return declaredLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
