package com.pushit.entity;

import com.pushit.converter.StringListConverter;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/** Advertiser profile. Owns the campaign wallet. */
@Entity
@Table(
        name = "brands",
        indexes = {
            @Index(name = "idx_brands_user_id", columnList = "user_id"),
            @Index(name = "idx_brands_verification_status", columnList = "verification_status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"user", "currency", "pausedBy"})
public class Brand {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true)
    private User user;

    @Column(name = "company_name", length = 200)
    private String companyName;

    @Column(name = "industry", length = 100)
    private String industry;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "website", length = 255)
    private String website;

    @Column(name = "contact_email", length = 254)
    private String contactEmail;

    @Column(name = "phone_number", length = 30)
    private String phoneNumber;

    @Column(name = "address", columnDefinition = "TEXT")
    private String address;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    @Column(name = "verification_status", nullable = false, length = 20)
    private BrandVerificationStatus verificationStatus = BrandVerificationStatus.PENDING;

    @Column(name = "verification_confidence")
    private Double verificationConfidence;

    @Convert(converter = StringListConverter.class)
    @Builder.Default
    @Column(name = "verification_flags", columnDefinition = "TEXT")
    private List<String> verificationFlags = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_method", length = 10)
    private VerificationMethod verificationMethod;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @Builder.Default
    @Column(name = "profile_completed", nullable = false)
    private boolean profileCompleted = false;

    @Builder.Default
    @Column(name = "wallet_balance", nullable = false, precision = 12, scale = 2)
    private BigDecimal walletBalance = BigDecimal.ZERO;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "currency_id")
    private Currency currency;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "paused_by")
    private User pausedBy;

    @Column(name = "paused_at")
    private LocalDateTime pausedAt;

    @Column(name = "pause_reason", columnDefinition = "TEXT")
    private String pauseReason;

    @Version
    @Column(name = "version")
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isPaused() {
        return verificationStatus == BrandVerificationStatus.PAUSED;
    }

    @PrePersist
    @PreUpdate
    private void validateBalance() {
        if (walletBalance != null && walletBalance.signum() < 0) {
            throw new IllegalStateException("Wallet balance cannot be negative for brand " + id);
        }
    }
}
