package com.pushit.dto.response;

import com.pushit.entity.Currency;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrencyResponse {
    private Long id;
    private String code;
    private String name;
    private String symbol;
    private boolean isDefault;
    private boolean active;
    private BigDecimal exchangeRate;

    public static CurrencyResponse fromEntity(Currency currency) {
        return CurrencyResponse.builder()
                .id(currency.getId())
                .code(currency.getCode())
                .name(currency.getName())
                .symbol(currency.getSymbol())
                .isDefault(currency.isDefault())
                .active(currency.isActive())
                .exchangeRate(currency.getExchangeRate())
                .build();
    }
}
