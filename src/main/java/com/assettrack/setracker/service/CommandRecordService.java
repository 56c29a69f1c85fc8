package com.assettrack.setracker.service;

import com.assettrack.setracker.exception.StoreException;
import com.assettrack.setracker.model.CommandRecord;
import com.assettrack.setracker.repository.CommandRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of device records. Each save is its own transaction, so a
 * failed supplemental record never rolls back the baseline one.
 */
@Service
public class CommandRecordService {
    private static final Logger logger = LoggerFactory.getLogger(CommandRecordService.class);

    private final CommandRecordRepository commandRecordRepository;

    public CommandRecordService(CommandRecordRepository commandRecordRepository) {
        this.commandRecordRepository = commandRecordRepository;
    }

    /**
     * @return generated id of the stored record
     * @throws StoreException when the record could not be written
     */
    @Transactional
    public Long save(CommandRecord record) {
        try {
            CommandRecord saved = commandRecordRepository.save(record);
            logger.debug("Saved {} record ID {} for device {}",
                    saved.getType(), saved.getId(), saved.getDeviceId());
            return saved.getId();
        } catch (DataAccessException e) {
            throw new StoreException(record.getDeviceId(), record.getType(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<CommandRecord> getRecords(String deviceId) {
        return commandRecordRepository.findByDeviceIdOrderByReceivedAtDescIdDesc(deviceId);
    }

    @Transactional(readOnly = true)
    public List<CommandRecord> getRecords(String deviceId, String type) {
        return commandRecordRepository.findByDeviceIdAndTypeOrderByReceivedAtDescIdDesc(deviceId, type);
    }

    @Transactional(readOnly = true)
    public List<CommandRecord> getPositions(String deviceId) {
        return commandRecordRepository.findPositionsByDeviceId(deviceId);
    }

    @Transactional(readOnly = true)
    public Optional<CommandRecord> getLatestRecord(String deviceId) {
        return commandRecordRepository.findFirstByDeviceIdOrderByReceivedAtDescIdDesc(deviceId);
    }
}
