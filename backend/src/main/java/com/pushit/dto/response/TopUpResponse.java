package com.pushit.dto.response;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopUpResponse {
    private String reference;
    private String authorizationUrl;
    private String accessCode;
    private BigDecimal amount;
    private String currency;
}
