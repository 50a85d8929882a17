package com.pushit.controller;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.request.BrandProfileRequest;
import com.pushit.dto.request.TopUpRequest;
import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.BrandResponse;
import com.pushit.dto.response.CampaignResponse;
import com.pushit.dto.response.TopUpResponse;
import com.pushit.dto.response.TransactionResponse;
import com.pushit.entity.Brand;
import com.pushit.entity.User;
import com.pushit.security.CurrentUser;
import com.pushit.service.brand.BrandService;
import com.pushit.service.campaign.CampaignService;
import com.pushit.service.payment.PaystackService;
import com.pushit.service.wallet.WalletService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(API_BASE_PATH + "/brands/me")
@RequiredArgsConstructor
@Tag(name = "Brand", description = "Brand profile and wallet")
public class BrandController {

    private final BrandService brandService;
    private final CampaignService campaignService;
    private final PaystackService paystackService;
    private final WalletService walletService;

    @GetMapping
    public ResponseEntity<ApiResponse<BrandResponse>> getProfile(@CurrentUser User user) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        BrandResponse.fromEntity(brandService.getByUser(user.getId()))));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<BrandResponse>> updateProfile(
            @CurrentUser User user, @Valid @RequestBody BrandProfileRequest request) {
        Brand brand = brandService.updateProfile(user.getId(), request);
        return ResponseEntity.ok(ApiResponse.success(BrandResponse.fromEntity(brand)));
    }

    @PostMapping("/complete")
    @Operation(summary = "Mark the profile complete and queue it for verification")
    public ResponseEntity<ApiResponse<BrandResponse>> completeProfile(@CurrentUser User user) {
        Brand brand = brandService.completeProfile(user.getId());
        return ResponseEntity.ok(
                ApiResponse.success(
                        BrandResponse.fromEntity(brand),
                        "Profile submitted, verification will run in a few minutes"));
    }

    @PostMapping("/wallet/top-up")
    @Operation(summary = "Start a Paystack checkout to fund the wallet")
    public ResponseEntity<ApiResponse<TopUpResponse>> topUp(
            @CurrentUser User user, @Valid @RequestBody TopUpRequest request) {
        Brand brand = brandService.getByUser(user.getId());
        return ResponseEntity.ok(
                ApiResponse.success(paystackService.initializeTopUp(brand, request.getAmount())));
    }

    @GetMapping("/transactions")
    public ResponseEntity<ApiResponse<List<TransactionResponse>>> transactions(
            @CurrentUser User user) {
        Brand brand = brandService.getByUser(user.getId());
        return ResponseEntity.ok(
                ApiResponse.success(
                        walletService.history(brand.getId()).stream()
                                .map(TransactionResponse::fromEntity)
                                .toList()));
    }

    @GetMapping("/campaigns")
    public ResponseEntity<ApiResponse<List<CampaignResponse>>> campaigns(@CurrentUser User user) {
        Brand brand = brandService.getByUser(user.getId());
        return ResponseEntity.ok(
                ApiResponse.success(
                        campaignService.listForBrand(brand.getId()).stream()
                                .map(CampaignResponse::fromEntity)
                                .toList()));
    }
}
