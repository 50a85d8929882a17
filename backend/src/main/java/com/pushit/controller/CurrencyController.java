package com.pushit.controller;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.CurrencyConversionResponse;
import com.pushit.dto.response.CurrencyResponse;
import com.pushit.service.currency.CurrencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only currency endpoints for brands and influencers. */
@Validated
@RestController
@RequestMapping(API_BASE_PATH + "/currency")
@RequiredArgsConstructor
@Tag(name = "Currency", description = "Supported currencies and conversion")
public class CurrencyController {

    private final CurrencyService currencyService;

    @GetMapping("/supported")
    @Operation(summary = "Active currencies with their rates against the base currency")
    public ResponseEntity<ApiResponse<List<CurrencyResponse>>> supported() {
        return ResponseEntity.ok(
                ApiResponse.success(
                        currencyService.listActive().stream()
                                .map(CurrencyResponse::fromEntity)
                                .toList()));
    }

    @GetMapping("/default")
    public ResponseEntity<ApiResponse<String>> defaultCurrency() {
        return ResponseEntity.ok(ApiResponse.success(currencyService.getDefaultCode()));
    }

    @GetMapping("/convert")
    @Operation(summary = "Quick convert", description = "Converts through the base currency")
    public ResponseEntity<ApiResponse<CurrencyConversionResponse>> convert(
            @RequestParam @NotBlank String from,
            @RequestParam @NotBlank String to,
            @RequestParam @NotNull @PositiveOrZero BigDecimal amount) {
        BigDecimal converted = currencyService.convert(amount, from, to);
        return ResponseEntity.ok(
                ApiResponse.success(
                        CurrencyConversionResponse.builder()
                                .originalAmount(amount)
                                .fromCurrency(from)
                                .convertedAmount(converted)
                                .toCurrency(to)
                                .formatted(currencyService.format(converted, to))
                                .build()));
    }
}
