package com.pushit.repository;

import com.pushit.entity.Payout;
import com.pushit.entity.PayoutStatus;
import com.pushit.entity.SubmissionStatus;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PayoutRepository extends JpaRepository<Payout, Long> {

    Optional<Payout> findBySubmissionId(Long submissionId);

    List<Payout> findByInfluencerIdOrderByCreatedAtDesc(Long influencerId);

    List<Payout> findByInfluencerIdAndStatus(Long influencerId, PayoutStatus status);

    @Query(
            """
        SELECT p FROM Payout p
        WHERE p.influencer.id = :influencerId
        AND p.status = com.pushit.entity.PayoutStatus.PENDING
        AND p.submission.status IN :submissionStatuses
        """)
    List<Payout> findPendingByInfluencerAndSubmissionStatus(
            @Param("influencerId") Long influencerId,
            @Param("submissionStatuses") Collection<SubmissionStatus> submissionStatuses);

    @Query(
            """
        SELECT p FROM Payout p
        WHERE p.influencer.id = :influencerId
        AND p.status = com.pushit.entity.PayoutStatus.PENDING
        AND p.submission.status = com.pushit.entity.SubmissionStatus.VERIFIED
        AND p.withdrawalRequest IS NULL
        ORDER BY p.createdAt ASC
        """)
    List<Payout> findWithdrawable(@Param("influencerId") Long influencerId);

    @Query(
            """
        SELECT p FROM Payout p
        WHERE p.status = com.pushit.entity.PayoutStatus.PENDING
        AND p.dueDate < :today
        ORDER BY p.dueDate ASC
        """)
    List<Payout> findOverdue(@Param("today") LocalDate today);
}
