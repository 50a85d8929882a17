package com.pushit.controller.admin;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.request.CurrencyRequest;
import com.pushit.dto.request.PlatformSettingsRequest;
import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.CurrencyResponse;
import com.pushit.dto.response.PlatformSettingsResponse;
import com.pushit.entity.Platform;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.verification.PlatformSettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(API_BASE_PATH + "/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Settings", description = "Currencies and platform thresholds")
public class AdminSettingsController {

    private final CurrencyService currencyService;
    private final PlatformSettingsService platformSettingsService;

    @GetMapping("/currencies")
    public ResponseEntity<ApiResponse<List<CurrencyResponse>>> currencies() {
        return ResponseEntity.ok(
                ApiResponse.success(
                        currencyService.listAll().stream()
                                .map(CurrencyResponse::fromEntity)
                                .toList()));
    }

    @PostMapping("/currencies")
    @Operation(summary = "Add a currency with its rate against the base currency")
    public ResponseEntity<ApiResponse<CurrencyResponse>> createCurrency(
            @Valid @RequestBody CurrencyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(
                        ApiResponse.success(
                                CurrencyResponse.fromEntity(currencyService.create(request))));
    }

    @PutMapping("/currencies/{code}")
    public ResponseEntity<ApiResponse<CurrencyResponse>> updateCurrency(
            @PathVariable String code, @Valid @RequestBody CurrencyRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        CurrencyResponse.fromEntity(currencyService.update(code, request))));
    }

    @DeleteMapping("/currencies/{code}")
    public ResponseEntity<ApiResponse<Void>> deleteCurrency(@PathVariable String code) {
        currencyService.delete(code);
        return ResponseEntity.ok(ApiResponse.success(null, "Currency " + code + " removed"));
    }

    @PostMapping("/currencies/{code}/default")
    @Operation(summary = "Make a currency the platform default, clearing the previous one")
    public ResponseEntity<ApiResponse<CurrencyResponse>> setDefaultCurrency(
            @PathVariable String code) {
        return ResponseEntity.ok(
                ApiResponse.success(CurrencyResponse.fromEntity(currencyService.setDefault(code))));
    }

    @GetMapping("/platform-settings")
    public ResponseEntity<ApiResponse<List<PlatformSettingsResponse>>> platformSettings() {
        return ResponseEntity.ok(
                ApiResponse.success(
                        platformSettingsService.listAll().stream()
                                .map(PlatformSettingsResponse::fromEntity)
                                .toList()));
    }

    @PutMapping("/platform-settings/{platform}")
    public ResponseEntity<ApiResponse<PlatformSettingsResponse>> updatePlatformSettings(
            @PathVariable Platform platform, @Valid @RequestBody PlatformSettingsRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        PlatformSettingsResponse.fromEntity(
                                platformSettingsService.update(platform, request))));
    }
}
