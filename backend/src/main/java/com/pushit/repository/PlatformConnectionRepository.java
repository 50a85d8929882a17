package com.pushit.repository;

import com.pushit.entity.ConnectionVerificationStatus;
import com.pushit.entity.Platform;
import com.pushit.entity.PlatformConnection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PlatformConnectionRepository extends JpaRepository<PlatformConnection, Long> {

    List<PlatformConnection> findByInfluencerId(Long influencerId);

    List<PlatformConnection> findByInfluencerIdAndVerificationStatus(
            Long influencerId, ConnectionVerificationStatus status);

    Optional<PlatformConnection> findByInfluencerIdAndPlatform(
            Long influencerId, Platform platform);

    boolean existsByInfluencerIdAndPlatform(Long influencerId, Platform platform);

    @Query(
            """
        SELECT pc FROM PlatformConnection pc
        WHERE pc.verificationStatus = :status
        ORDER BY pc.createdAt ASC
        """)
    List<PlatformConnection> findByStatusOldestFirst(
            @Param("status") ConnectionVerificationStatus status, Pageable pageable);

    /** Verified accounts with a large audience but almost no engagement. */
    @Query(
            """
        SELECT pc FROM PlatformConnection pc
        WHERE pc.verificationStatus = com.pushit.entity.ConnectionVerificationStatus.VERIFIED
        AND pc.followersCount >= :followerThreshold
        AND pc.engagementRate > 0 AND pc.engagementRate < :engagementCeiling
        """)
    List<PlatformConnection> findHighReachLowEngagement(
            @Param("followerThreshold") long followerThreshold,
            @Param("engagementCeiling") double engagementCeiling);

    @Query(
            """
        SELECT pc FROM PlatformConnection pc
        WHERE pc.verificationStatus = com.pushit.entity.ConnectionVerificationStatus.VERIFIED
        AND pc.engagementRate < :engagementFloor
        """)
    List<PlatformConnection> findVerifiedWithEngagementBelow(
            @Param("engagementFloor") double engagementFloor);
}
