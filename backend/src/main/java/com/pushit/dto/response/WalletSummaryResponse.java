package com.pushit.dto.response;

import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Influencer earnings, all amounts in the influencer's settlement currency. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletSummaryResponse {
    private String currency;
    private BigDecimal available;
    private BigDecimal pendingClearance;
    private BigDecimal totalEarned;
    private String availableFormatted;
    private long overdueCount;
    private List<PayoutResponse> recentPayouts;
}
