package com.distributedsystems.archon.repository;

import com.distributedsystems.archon.model.OutboxEntryEntity;
import com.distributedsystems.archon.model.OutboxStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IOutboxRepository extends JpaRepository<OutboxEntryEntity, Long> {

    /** Pending entries whose retry time has passed, oldest first. */
    @Query("SELECT e FROM OutboxEntryEntity e WHERE e.status = :status AND e.nextAttemptAtMs <= :nowMs "
            + "ORDER BY e.seq ASC")
    List<OutboxEntryEntity> findDue(@Param("status") OutboxStatus status,
                                    @Param("nowMs") long nowMs,
                                    Pageable pageable);

    /** Every entry in {@code status}, oldest first, regardless of its retry time. */
    @Query("SELECT e FROM OutboxEntryEntity e WHERE e.status = :status ORDER BY e.seq ASC")
    List<OutboxEntryEntity> findOldest(@Param("status") OutboxStatus status, Pageable pageable);

    long countByStatus(OutboxStatus status);

    @Modifying
    @Query("UPDATE OutboxEntryEntity e SET e.status = :to, e.attempts = 0, e.nextAttemptAtMs = :nowMs, "
            + "e.updatedAt = :nowSec WHERE e.status = :from")
    int requeue(@Param("from") OutboxStatus from,
                @Param("to") OutboxStatus to,
                @Param("nowMs") long nowMs,
                @Param("nowSec") long nowSec);

    @Modifying
    @Query("DELETE FROM OutboxEntryEntity e WHERE e.status = :status")
    int deleteByStatusBulk(@Param("status") OutboxStatus status);
}
