package com.pushit.dto.response;

import com.pushit.entity.WithdrawalRequest;
import com.pushit.entity.WithdrawalStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawalResponse {
    private Long id;
    private BigDecimal amount;
    private String currency;
    private Long paymentMethodId;
    private WithdrawalStatus status;
    private LocalDateTime createdAt;

    public static WithdrawalResponse fromEntity(WithdrawalRequest request) {
        return WithdrawalResponse.builder()
                .id(request.getId())
                .amount(request.getAmount())
                .currency(request.getCurrency())
                .paymentMethodId(request.getPaymentMethod().getId())
                .status(request.getStatus())
                .createdAt(request.getCreatedAt())
                .build();
    }
}
