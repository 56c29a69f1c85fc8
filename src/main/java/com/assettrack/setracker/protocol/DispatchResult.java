package com.assettrack.setracker.protocol;

import com.assettrack.setracker.model.CommandRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of dispatching one frame: an optional reply frame and the records to store.
 * The first record is always the baseline record of the frame.
 */
public final class DispatchResult {
    private final CommandType commandType;
    private final String reply;
    private final List<CommandRecord> records;

    public DispatchResult(CommandType commandType, String reply, List<CommandRecord> records) {
        this.commandType = commandType;
        this.reply = reply;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public CommandType getCommandType() {
        return commandType;
    }

    public Optional<String> getReply() {
        return Optional.ofNullable(reply);
    }

    public List<CommandRecord> getRecords() {
        return records;
    }

    public boolean hasReply() {
        return reply != null;
    }
}
