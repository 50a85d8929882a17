package com.pushit.dto.response;

import com.pushit.entity.Brand;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.VerificationMethod;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrandResponse {
    private Long id;
    private String companyName;
    private String industry;
    private String description;
    private String website;
    private String contactEmail;
    private String phoneNumber;
    private String address;
    private BrandVerificationStatus verificationStatus;
    private Double verificationConfidence;
    private List<String> verificationFlags;
    private VerificationMethod verificationMethod;
    private LocalDateTime verifiedAt;
    private boolean profileCompleted;
    private BigDecimal walletBalance;
    private String currency;
    private boolean paused;
    private String pauseReason;

    public static BrandResponse fromEntity(Brand brand) {
        return BrandResponse.builder()
                .id(brand.getId())
                .companyName(brand.getCompanyName())
                .industry(brand.getIndustry())
                .description(brand.getDescription())
                .website(brand.getWebsite())
                .contactEmail(brand.getContactEmail())
                .phoneNumber(brand.getPhoneNumber())
                .address(brand.getAddress())
                .verificationStatus(brand.getVerificationStatus())
                .verificationConfidence(brand.getVerificationConfidence())
                .verificationFlags(List.copyOf(brand.getVerificationFlags()))
                .verificationMethod(brand.getVerificationMethod())
                .verifiedAt(brand.getVerifiedAt())
                .profileCompleted(brand.isProfileCompleted())
                .walletBalance(brand.getWalletBalance())
                .currency(brand.getCurrency() != null ? brand.getCurrency().getCode() : null)
                .paused(brand.isPaused())
                .pauseReason(brand.getPauseReason())
                .build();
    }
}
