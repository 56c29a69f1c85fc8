package com.assettrack.setracker.model;

import java.util.Objects;

/**
 * A parsed SeTracker frame: {@code [manufacturer*deviceId*length*content]}.
 * Immutable; the declared length always equals the content length.
 */
public final class SeTrackerMessage {
    private final String manufacturer;
    private final String deviceId;
    private final int declaredLength;
    private final String content;

    public SeTrackerMessage(String manufacturer, String deviceId, int declaredLength, String content) {
        this.manufacturer = Objects.requireNonNull(manufacturer, "manufacturer");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.declaredLength = declaredLength;
        this.content = Objects.requireNonNull(content, "content");
    }

    public String getManufacturer() {
        return manufacturer;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public int getDeclaredLength() {
        return declaredLength;
    }

    public String getContent() {
        return content;
    }

    /**
     * First comma-separated field of the content, or the whole content when it has no comma.
     */
    public String getToken() {
        int comma = content.indexOf(',');
        return comma < 0 ? content : content.substring(0, comma);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeTrackerMessage)) return false;
        SeTrackerMessage that = (SeTrackerMessage) o;
        return declaredLength == that.declaredLength
                && manufacturer.equals(that.manufacturer)
                && deviceId.equals(that.deviceId)
                && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(manufacturer, deviceId, declaredLength, content);
    }

    @Override
    public String toString() {
        return "SeTrackerMessage{" +
                "manufacturer='" + manufacturer + '\'' +
                ", deviceId='" + deviceId + '\'' +
                ", declaredLength=" + declaredLength +
                ", content='" + content + '\'' +
                '}';
    }
}
