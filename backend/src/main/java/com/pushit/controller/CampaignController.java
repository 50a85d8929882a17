package com.pushit.controller;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.request.CampaignRequest;
import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.CampaignResponse;
import com.pushit.entity.Campaign;
import com.pushit.entity.User;
import com.pushit.security.CurrentUser;
import com.pushit.service.brand.BrandService;
import com.pushit.service.campaign.CampaignService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(API_BASE_PATH + "/campaigns")
@RequiredArgsConstructor
@Tag(name = "Campaigns", description = "Campaign lifecycle")
public class CampaignController {

    private final CampaignService campaignService;
    private final BrandService brandService;

    @PostMapping
    @Operation(
            summary = "Create a campaign",
            description = "The budget is debited from the brand wallet in the same transaction")
    public ResponseEntity<ApiResponse<CampaignResponse>> create(
            @CurrentUser User user, @Valid @RequestBody CampaignRequest request) {
        Campaign campaign = campaignService.createCampaign(brandId(user), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(CampaignResponse.fromEntity(campaign)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<CampaignResponse>> update(
            @CurrentUser User user,
            @PathVariable Long id,
            @Valid @RequestBody CampaignRequest request) {
        return ok(campaignService.updateCampaign(brandId(user), id, request));
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<ApiResponse<CampaignResponse>> activate(
            @CurrentUser User user, @PathVariable Long id) {
        return ok(campaignService.activateCampaign(brandId(user), id));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<ApiResponse<CampaignResponse>> pause(
            @CurrentUser User user, @PathVariable Long id) {
        return ok(campaignService.pauseCampaign(brandId(user), id));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<ApiResponse<CampaignResponse>> resume(
            @CurrentUser User user, @PathVariable Long id) {
        return ok(campaignService.resumeCampaign(brandId(user), id));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<ApiResponse<CampaignResponse>> complete(
            @CurrentUser User user, @PathVariable Long id) {
        return ok(campaignService.completeCampaign(brandId(user), id));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a draft or paused campaign", description = "No automatic refund")
    public ResponseEntity<ApiResponse<CampaignResponse>> cancel(
            @CurrentUser User user, @PathVariable Long id) {
        return ok(campaignService.cancelCampaign(brandId(user), id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<CampaignResponse>> get(@PathVariable Long id) {
        return ok(campaignService.getCampaign(id, null));
    }

    @GetMapping
    @Operation(summary = "Active campaigns open to influencers")
    public ResponseEntity<ApiResponse<List<CampaignResponse>>> listActive() {
        return ResponseEntity.ok(
                ApiResponse.success(
                        campaignService.listActive().stream()
                                .map(CampaignResponse::fromEntity)
                                .toList()));
    }

    private Long brandId(User user) {
        return brandService.getByUser(user.getId()).getId();
    }

    private static ResponseEntity<ApiResponse<CampaignResponse>> ok(Campaign campaign) {
        return ResponseEntity.ok(ApiResponse.success(CampaignResponse.fromEntity(campaign)));
    }
}
