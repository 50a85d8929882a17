package com.pushit.dto.response;

import com.pushit.entity.Payout;
import com.pushit.entity.PayoutStatus;
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
public class PayoutResponse {
    private Long id;
    private Long submissionId;
    private Long influencerId;
    private Long campaignId;
    private BigDecimal amount;
    private String currency;
    private LocalDate dueDate;
    private PayoutStatus status;
    private boolean overdue;
    private String reference;
    private LocalDateTime sentAt;

    public static PayoutResponse fromEntity(Payout payout, LocalDate today) {
        return PayoutResponse.builder()
                .id(payout.getId())
                .submissionId(payout.getSubmission().getId())
                .influencerId(payout.getInfluencer().getId())
                .campaignId(payout.getCampaign().getId())
                .amount(payout.getAmount())
                .currency(payout.getCurrency())
                .dueDate(payout.getDueDate())
                .status(payout.getStatus())
                .overdue(payout.isOverdue(today))
                .reference(payout.getReference())
                .sentAt(payout.getSentAt())
                .build();
    }
}
