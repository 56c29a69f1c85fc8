package com.assettrack.setracker.model;

import java.util.Objects;

/**
 * A server-initiated command addressed to one device.
 */
public final class OutboundCommand {
    private final String deviceId;
    private final String commandToken;
    private final String extraContent;

    public OutboundCommand(String deviceId, String commandToken, String extraContent) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.commandToken = Objects.requireNonNull(commandToken, "commandToken");
        this.extraContent = extraContent == null ? "" : extraContent;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getCommandToken() {
        return commandToken;
    }

    public String getExtraContent() {
        return extraContent;
    }

    /**
     * Token followed by its extra content, as it appears in the frame body.
     */
    public String getBody() {
        return commandToken + extraContent;
    }

    @Override
    public String toString() {
        return "OutboundCommand{deviceId='" + deviceId + "', body='" + getBody() + "'}";
    }
}
