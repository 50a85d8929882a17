package com.pushit.repository;

import com.pushit.entity.QueueSubjectType;
import com.pushit.entity.VerificationQueueEntry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface VerificationQueueRepository extends JpaRepository<VerificationQueueEntry, Long> {

    Optional<VerificationQueueEntry> findBySubjectTypeAndSubjectId(
            QueueSubjectType subjectType, Long subjectId);

    /** Due, unprocessed entries that nobody holds a live lease on. */
    @Query(
            """
        SELECT q FROM VerificationQueueEntry q
        WHERE q.processed = false
        AND q.scheduledAt <= :now
        AND (q.claimedAt IS NULL OR q.claimedAt < :leaseExpiredBefore)
        ORDER BY q.scheduledAt ASC
        """)
    List<VerificationQueueEntry> findClaimable(
            @Param("now") LocalDateTime now,
            @Param("leaseExpiredBefore") LocalDateTime leaseExpiredBefore,
            Pageable pageable);

    /**
     * Takes the lease on one entry. Returns 1 when this caller now owns it, 0 when another worker
     * got there first or the entry was processed meanwhile.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            """
        UPDATE VerificationQueueEntry q
        SET q.claimToken = :token, q.claimedAt = :now
        WHERE q.id = :id
        AND q.processed = false
        AND q.scheduledAt <= :now
        AND (q.claimedAt IS NULL OR q.claimedAt < :leaseExpiredBefore)
        """)
    int claim(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("now") LocalDateTime now,
            @Param("leaseExpiredBefore") LocalDateTime leaseExpiredBefore);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            """
        UPDATE VerificationQueueEntry q
        SET q.processed = true, q.processedAt = :now, q.lastOutcome = :outcome,
            q.claimToken = NULL, q.claimedAt = NULL
        WHERE q.id = :id AND q.claimToken = :token
        """)
    int complete(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("now") LocalDateTime now,
            @Param("outcome") String outcome);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            """
        UPDATE VerificationQueueEntry q
        SET q.claimToken = NULL, q.claimedAt = NULL, q.lastOutcome = :outcome
        WHERE q.id = :id AND q.claimToken = :token
        """)
    int release(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("outcome") String outcome);

    long countByProcessedFalse();
}
