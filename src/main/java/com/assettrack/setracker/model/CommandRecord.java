package com.assettrack.setracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One stored notification from a device. Every accepted frame yields a
 * baseline record; position and snapshot frames add a second one carrying
 * the extracted fields.
 */
@Entity
@Table(name = "command_records", indexes = {
        @Index(name = "idx_command_records_device", columnList = "device_id, received_at")
})
@Getter @Setter
public class CommandRecord {

    // any field of an accepted frame fits, up to the default gps.server.max.frame.length
    public static final int MAX_FIELD_LENGTH = 65536;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, length = MAX_FIELD_LENGTH)
    private String deviceId;

    // Command token (LK, UD, AL, img...)
    @Column(nullable = false, length = MAX_FIELD_LENGTH)
    private String type;

    @Lob
    @Column(name = "raw_content")
    private String rawContent;

    @Column(name = "received_at", nullable = false)
    private LocalDateTime receivedAt;

    private Double latitude;
    private Double longitude;
    private Integer batteryLevel; // percentage
    private Integer signalStrength;

    // Snapshot time as reported by the device
    @Column(name = "device_time", length = MAX_FIELD_LENGTH)
    private String deviceTime;

    @Lob
    @Column(name = "image_data")
    private String imageData;

    public CommandRecord() {
    }

    public CommandRecord(String deviceId, String type, String rawContent, LocalDateTime receivedAt) {
        this.deviceId = deviceId;
        this.type = type;
        this.rawContent = rawContent;
        this.receivedAt = receivedAt;
    }

    public boolean hasPosition() {
        return latitude != null && longitude != null;
    }

    @Override
    public String toString() {
        return "CommandRecord{" +
                "id=" + id +
                ", deviceId='" + deviceId + '\'' +
                ", type='" + type + '\'' +
                ", receivedAt=" + receivedAt +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                ", batteryLevel=" + batteryLevel +
                ", signalStrength=" + signalStrength +
                '}';
    }
}
