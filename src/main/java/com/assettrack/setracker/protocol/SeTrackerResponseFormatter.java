package com.assettrack.setracker.protocol;

import com.assettrack.setracker.model.OutboundCommand;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders frames going back to the device.
 */
@Component
public class SeTrackerResponseFormatter {

    /**
     * Manufacturer prefix of server-initiated commands. Used for every device,
     * whatever prefix the device itself sends.
     */
    public static final String OUTBOUND_MANUFACTURER = "3G";

    /**
     * Largest body whose length still fits the four-digit length field.
     */
    public static final int MAX_BODY_LENGTH = 9999;

    /**
     * Builds {@code [manufacturer*deviceId*lengthField*body]}. The length field
     * is written as given; protocol replies use fixed values from {@link CommandType}.
     */
    public String format(String manufacturer, String deviceId, String lengthField, String body) {
        return "[" + manufacturer + "*" + deviceId + "*" + lengthField + "*" + body + "]";
    }

    /**
     * Builds a server-initiated command frame. Unlike replies, the length field
     * is the decimal character count of {@code command + extraContent},
     * zero-padded to four digits.
     *
     * @throws IllegalArgumentException when the body is longer than {@link #MAX_BODY_LENGTH}
     */
    public String compose(String deviceId, String command, String extraContent) {
        return compose(new OutboundCommand(deviceId, command, extraContent));
    }

    public String compose(OutboundCommand command) {
        String body = command.getBody();
        if (body.length() > MAX_BODY_LENGTH) {
            throw new IllegalArgumentException("Command body of " + body.length()
                    + " characters exceeds " + MAX_BODY_LENGTH);
        }
        return format(OUTBOUND_MANUFACTURER, command.getDeviceId(), zeroPad4(body.length()), body);
    }

    static String zeroPad4(int length) {
        return String.format(Locale.ROOT, "%04d", length);
    }
}
