package com.assettrack.setracker.service;

import com.assettrack.setracker.exception.StoreException;
import com.assettrack.setracker.exception.ValidationException;
import com.assettrack.setracker.model.CommandRecord;
import com.assettrack.setracker.model.SeTrackerMessage;
import com.assettrack.setracker.protocol.CommandDispatcher;
import com.assettrack.setracker.protocol.DispatchResult;
import com.assettrack.setracker.protocol.SeTrackerMessageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Runs one inbound frame through parse, dispatch and persistence, and hands
 * back the reply to write. Rejected frames produce neither a reply nor a record.
 * Storage failures are logged per record and never suppress the reply.
 */
@Service
public class FrameProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(FrameProcessingService.class);

    private final SeTrackerMessageParser parser;
    private final CommandDispatcher dispatcher;
    private final CommandRecordService commandRecordService;

    public FrameProcessingService(SeTrackerMessageParser parser,
                                  CommandDispatcher dispatcher,
                                  CommandRecordService commandRecordService) {
        this.parser = parser;
        this.dispatcher = dispatcher;
        this.commandRecordService = commandRecordService;
    }

    /**
     * @return the processed frame, or empty when the frame was rejected by the parser
     */
    public Optional<ProcessedFrame> process(String frame) {
        SeTrackerMessage message;
        try {
            message = parser.parse(frame);
        } catch (ValidationException e) {
            logger.warn("Failed to parse message: {} ({})", e.getPayloadFragment(), e.getMessage());
            return Optional.empty();
        }

        logger.info("Parsed message: manufacturer={}, deviceId={}, length={}, content={}",
                message.getManufacturer(), message.getDeviceId(),
                message.getDeclaredLength(), message.getContent());

        DispatchResult result = dispatcher.dispatch(message);
        List<Long> storedIds = new ArrayList<>(result.getRecords().size());
        for (CommandRecord record : result.getRecords()) {
            try {
                storedIds.add(commandRecordService.save(record));
            } catch (StoreException e) {
                logger.error("{}, continuing", e.getMessage(), e);
            }
        }
        return Optional.of(new ProcessedFrame(message, result, storedIds));
    }

    public static final class ProcessedFrame {
        private final SeTrackerMessage message;
        private final DispatchResult result;
        private final List<Long> storedRecordIds;

        ProcessedFrame(SeTrackerMessage message, DispatchResult result, List<Long> storedRecordIds) {
            this.message = message;
            this.result = result;
            this.storedRecordIds = Collections.unmodifiableList(storedRecordIds);
        }

        public SeTrackerMessage getMessage() {
            return message;
        }

        public String getDeviceId() {
            return message.getDeviceId();
        }

        public Optional<String> getReply() {
            return result.getReply();
        }

        public DispatchResult getResult() {
            return result;
        }

        public List<Long> getStoredRecordIds() {
            return storedRecordIds;
        }
    }
}
