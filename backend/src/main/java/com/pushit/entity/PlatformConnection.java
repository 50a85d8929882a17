package com.pushit.entity;

import com.pushit.converter.StringListConverter;
import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * An influencer's account on one platform. {@code followersCount} is what the influencer declared;
 * {@code verifiedFollowersCount} is the last count fetched from the platform.
 */
@Entity
@Table(
        name = "platform_connections",
        uniqueConstraints = {
            @UniqueConstraint(
                    name = "uk_platform_connections_influencer_platform",
                    columnNames = {"influencer_id", "platform"})
        },
        indexes = {
            @Index(
                    name = "idx_platform_connections_status",
                    columnList = "verification_status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"influencer", "accessToken"})
public class PlatformConnection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "influencer_id", nullable = false)
    private Influencer influencer;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 20)
    private Platform platform;

    @Column(name = "handle", nullable = false, length = 100)
    private String handle;

    @Builder.Default
    @Column(name = "followers_count", nullable = false)
    private long followersCount = 0;

    @Column(name = "verified_followers_count")
    private Long verifiedFollowersCount;

    @Column(name = "follower_verification_date")
    private LocalDateTime followerVerificationDate;

    @Builder.Default
    @Column(name = "engagement_rate", nullable = false)
    private double engagementRate = 0.0;

    @Builder.Default
    @Column(name = "avg_views", nullable = false)
    private long averageViews = 0;

    @Column(name = "sample_post_url", length = 500)
    private String samplePostUrl;

    @Column(name = "access_token", columnDefinition = "TEXT")
    private String accessToken;

    /** TikTok open id, Instagram business account id or Facebook page id. */
    @Column(name = "platform_account_id", length = 100)
    private String platformAccountId;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    @Column(name = "verification_status", nullable = false, length = 20)
    private ConnectionVerificationStatus verificationStatus = ConnectionVerificationStatus.PENDING;

    @Builder.Default
    @Column(name = "verification_confidence", nullable = false)
    private double verificationConfidence = 0.0;

    @Convert(converter = StringListConverter.class)
    @Builder.Default
    @Column(name = "verification_flags", columnDefinition = "TEXT")
    private List<String> verificationFlags = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_method", length = 10)
    private VerificationMethod verificationMethod;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /** Count used for admission rules: the fetched count when known, else the declared one. */
    public long getEffectiveFollowers() {
        return verifiedFollowersCount != null && verifiedFollowersCount > 0
                ? verifiedFollowersCount
                : followersCount;
    }

    @PrePersist
    @PreUpdate
    private void validate() {
        if (verificationConfidence < 0.0 || verificationConfidence > 1.0) {
            throw new IllegalStateException(
                    "Verification confidence out of range: " + verificationConfidence);
        }
        if (handle != null) {
            handle = handle.trim();
            if (handle.startsWith("@")) {
                handle = handle.substring(1);
            }
        }
    }
}
