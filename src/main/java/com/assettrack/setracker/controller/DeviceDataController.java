package com.assettrack.setracker.controller;

import com.assettrack.setracker.model.CommandRecord;
import com.assettrack.setracker.service.CommandRecordService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/gps/data")
@Tag(name = "Device data", description = "Records received from SeTracker devices")
public class DeviceDataController {
    private final CommandRecordService commandRecordService;

    public DeviceDataController(CommandRecordService commandRecordService) {
        this.commandRecordService = commandRecordService;
    }

    @GetMapping("/{deviceId}")
    @Operation(summary = "Records of a device, newest first, optionally filtered by command type")
    public List<CommandRecord> getDeviceData(
            @PathVariable String deviceId,
            @RequestParam(required = false) String type) {
        List<CommandRecord> records = type != null
                ? commandRecordService.getRecords(deviceId, type)
                : commandRecordService.getRecords(deviceId);
        if (records.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No data found for device " + deviceId);
        }
        return records;
    }

    @GetMapping("/{deviceId}/positions")
    @Operation(summary = "Records of a device carrying latitude and longitude, newest first")
    public List<CommandRecord> getPositions(@PathVariable String deviceId) {
        List<CommandRecord> positions = commandRecordService.getPositions(deviceId);
        if (positions.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No positions found for device " + deviceId);
        }
        return positions;
    }

    @GetMapping("/{deviceId}/latest")
    @Operation(summary = "Most recent record of a device")
    public CommandRecord getLatest(@PathVariable String deviceId) {
        return commandRecordService.getLatestRecord(deviceId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No data found for device " + deviceId));
    }
}
