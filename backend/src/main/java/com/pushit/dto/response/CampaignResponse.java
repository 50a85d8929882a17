package com.pushit.dto.response;

import com.pushit.entity.Campaign;
import com.pushit.entity.CampaignStatus;
import com.pushit.entity.Platform;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignResponse {
    private Long id;
    private Long brandId;
    private String name;
    private String description;
    private Platform platform;
    private String niche;
    private int packageVideos;
    private BigDecimal budget;
    private String currency;
    private LocalDate startDate;
    private LocalDate dueDate;
    private CampaignStatus status;
    private LocalDateTime createdAt;

    public static CampaignResponse fromEntity(Campaign campaign) {
        return CampaignResponse.builder()
                .id(campaign.getId())
                .brandId(campaign.getBrand().getId())
                .name(campaign.getName())
                .description(campaign.getDescription())
                .platform(campaign.getPlatform())
                .niche(campaign.getNiche())
                .packageVideos(campaign.getPackageVideos())
                .budget(campaign.getBudget())
                .currency(campaign.getCurrency())
                .startDate(campaign.getStartDate())
                .dueDate(campaign.getDueDate())
                .status(campaign.getStatus())
                .createdAt(campaign.getCreatedAt())
                .build();
    }
}
