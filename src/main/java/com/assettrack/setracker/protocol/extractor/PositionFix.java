package com.assettrack.setracker.protocol.extractor;

import java.util.Optional;

/**
 * Fields read from a UD/UD2/PP position report. Each numeric field is empty
 * when the device left it out or sent something unparsable.
 */
public final class PositionFix {
    private final String type;
    private final Double latitude;
    private final Double longitude;
    private final Integer signalStrength;
    private final Integer batteryLevel;

    public PositionFix(String type, Double latitude, Double longitude,
                       Integer signalStrength, Integer batteryLevel) {
        this.type = type;
        this.latitude = latitude;
        this.longitude = longitude;
        this.signalStrength = signalStrength;
        this.batteryLevel = batteryLevel;
    }

    public String getType() {
        return type;
    }

    public Optional<Double> getLatitude() {
        return Optional.ofNullable(latitude);
    }

    public Optional<Double> getLongitude() {
        return Optional.ofNullable(longitude);
    }

    public Optional<Integer> getSignalStrength() {
        return Optional.ofNullable(signalStrength);
    }

    public Optional<Integer> getBatteryLevel() {
        return Optional.ofNullable(batteryLevel);
    }

    @Override
    public String toString() {
        return "PositionFix{type=" + type + ", lat=" + latitude + ", lon=" + longitude
                + ", signal=" + signalStrength + ", battery=" + batteryLevel + '}';
    }
}
