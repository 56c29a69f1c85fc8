package com.assettrack.setracker.protocol.extractor;

/**
 * Decoded alarm word of an AL frame.
 */
public final class AlarmStatus {
    private final String bits;
    private final boolean fallDown;
    private final boolean sos;

    public AlarmStatus(String bits, boolean fallDown, boolean sos) {
        this.bits = bits;
        this.fallDown = fallDown;
        this.sos = sos;
    }

    /**
     * Alarm word as a binary string, most significant bit first.
     */
    public String getBits() {
        return bits;
    }

    public boolean isFallDown() {
        return fallDown;
    }

    public boolean isSos() {
        return sos;
    }

    @Override
    public String toString() {
        return "AlarmStatus{bits=" + bits + ", fallDown=" + fallDown + ", sos=" + sos + '}';
    }
}
