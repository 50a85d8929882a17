package com.pushit.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/** Where an influencer wants to be paid. At most one per influencer is the default. */
@Entity
@Table(
        name = "payment_methods",
        indexes = {
            @Index(name = "idx_payment_methods_influencer_id", columnList = "influencer_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"influencer", "accountNumber", "mobileMoneyNumber"})
public class PaymentMethod {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "influencer_id", nullable = false)
    private Influencer influencer;

    @Enumerated(EnumType.STRING)
    @Column(name = "method_type", nullable = false, length = 20)
    private PaymentMethodType methodType;

    @Builder.Default
    @Column(name = "is_default", nullable = false)
    private boolean isDefault = false;

    @Column(name = "bank_name", length = 100)
    private String bankName;

    @Column(name = "account_number", length = 50)
    private String accountNumber;

    @Column(name = "account_name", length = 150)
    private String accountName;

    @Enumerated(EnumType.STRING)
    @Column(name = "mobile_money_network", length = 20)
    private MobileMoneyNetwork mobileMoneyNetwork;

    @Column(name = "mobile_money_number", length = 20)
    private String mobileMoneyNumber;

    @Column(name = "mobile_money_name", length = 150)
    private String mobileMoneyName;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    private void validateDetails() {
        if (methodType == PaymentMethodType.BANK
                && (bankName == null || accountNumber == null || accountName == null)) {
            throw new IllegalStateException(
                    "Bank payment method requires bank and account details");
        }
        if (methodType == PaymentMethodType.MOBILE_MONEY
                && (mobileMoneyNetwork == null || mobileMoneyNumber == null)) {
            throw new IllegalStateException("Mobile money method requires network and number");
        }
    }
}
