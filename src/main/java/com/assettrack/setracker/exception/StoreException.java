package com.assettrack.setracker.exception;

/**
 * Raised when a command record could not be persisted.
 */
public class StoreException extends RuntimeException {
    private final String deviceId;
    private final String type;

    public StoreException(String deviceId, String type, Throwable cause) {
        super(String.format("Failed to store %s record for device %s", type, deviceId), cause);
        this.deviceId = deviceId;
        this.type = type;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getType() {
        return type;
    }
}
