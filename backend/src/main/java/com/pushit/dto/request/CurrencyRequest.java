package com.pushit.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrencyRequest {
    @NotBlank(message = "Currency code is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency code must have 3 letters")
    private String code;

    @NotBlank(message = "Currency name is required")
    @Size(max = 50)
    private String name;

    @NotBlank(message = "Currency symbol is required")
    @Size(max = 10)
    private String symbol;

    @DecimalMin(value = "0.0001", message = "Exchange rate must be positive")
    private BigDecimal exchangeRate;

    @Builder.Default private boolean active = true;
}
