package com.assettrack.setracker.controller;

import com.assettrack.setracker.service.CommandService;
import com.assettrack.setracker.service.CommandService.CommandDispatch;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Manual command injection. The response body is the frame that was composed;
 * 200 means it was queued on the device's connection, 202 that the device is offline.
 */
@RestController
@RequestMapping("/gps/command")
@Tag(name = "Commands", description = "Send server commands to SeTracker devices")
public class CommandController {
    private static final Logger logger = LoggerFactory.getLogger(CommandController.class);

    private final CommandService commandService;

    public CommandController(CommandService commandService) {
        this.commandService = commandService;
    }

    @PostMapping(value = "/{deviceId}/{command}", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Send a command", description = "Content is appended verbatim after the command, e.g. ,cmnet,,,20634")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Frame queued on the device connection"),
            @ApiResponse(responseCode = "202", description = "Device offline, frame not delivered"),
            @ApiResponse(responseCode = "400", description = "Invalid device id or command")
    })
    public ResponseEntity<String> sendCommand(
            @Parameter(description = "Device ID, e.g. 8800000015") @PathVariable String deviceId,
            @Parameter(description = "Command token, e.g. APN, UPLOAD, CR") @PathVariable String command,
            @Parameter(description = "Extra content") @RequestParam(required = false, defaultValue = "") String content) {
        return send(deviceId, command, content);
    }

    @PostMapping(value = "/{deviceId}/{command}/{content}", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Send a command with content in the path")
    public ResponseEntity<String> sendCommandWithContent(
            @PathVariable String deviceId,
            @PathVariable String command,
            @PathVariable String content) {
        return send(deviceId, command, content);
    }

    private ResponseEntity<String> send(String deviceId, String command, String content) {
        CommandDispatch dispatch;
        try {
            dispatch = commandService.sendCommand(deviceId, command, content);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }

        if (!dispatch.isDelivered()) {
            logger.info("Device {} offline, command not delivered: {}", deviceId, dispatch.getFrame());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(dispatch.getFrame());
        }
        return ResponseEntity.ok(dispatch.getFrame());
    }
}
