package com.assettrack.setracker.repository;

import com.assettrack.setracker.model.CommandRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CommandRecordRepository extends JpaRepository<CommandRecord, Long> {

    List<CommandRecord> findByDeviceIdOrderByReceivedAtDescIdDesc(String deviceId);

    List<CommandRecord> findByDeviceIdAndTypeOrderByReceivedAtDescIdDesc(String deviceId, String type);

    Optional<CommandRecord> findFirstByDeviceIdOrderByReceivedAtDescIdDesc(String deviceId);

    // Records carrying a position fix, newest first
    @Query("SELECT r FROM CommandRecord r WHERE r.deviceId = :deviceId " +
            "AND r.latitude IS NOT NULL AND r.longitude IS NOT NULL " +
            "ORDER BY r.receivedAt DESC, r.id DESC")
    List<CommandRecord> findPositionsByDeviceId(@Param("deviceId") String deviceId);
}
