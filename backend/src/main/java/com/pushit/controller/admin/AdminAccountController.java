package com.pushit.controller.admin;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.request.PauseRequest;
import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.BrandResponse;
import com.pushit.dto.response.InfluencerResponse;
import com.pushit.dto.response.PlatformConnectionResponse;
import com.pushit.entity.Influencer;
import com.pushit.entity.User;
import com.pushit.security.CurrentUser;
import com.pushit.service.brand.BrandService;
import com.pushit.service.influencer.InfluencerService;
import com.pushit.service.verification.ConnectionVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(API_BASE_PATH + "/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Accounts")
public class AdminAccountController {

    private final BrandService brandService;
    private final InfluencerService influencerService;
    private final ConnectionVerificationService connectionVerificationService;

    @GetMapping("/brands")
    public ResponseEntity<ApiResponse<List<BrandResponse>>> brands() {
        return ResponseEntity.ok(
                ApiResponse.success(
                        brandService.listAll().stream().map(BrandResponse::fromEntity).toList()));
    }

    @PostMapping("/brands/{id}/pause")
    @Operation(summary = "Pause a brand, blocking new campaigns")
    public ResponseEntity<ApiResponse<BrandResponse>> pauseBrand(
            @CurrentUser User admin,
            @PathVariable Long id,
            @Valid @RequestBody PauseRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        BrandResponse.fromEntity(
                                brandService.pause(admin, id, request.getReason()))));
    }

    @PostMapping("/brands/{id}/unpause")
    public ResponseEntity<ApiResponse<BrandResponse>> unpauseBrand(@PathVariable Long id) {
        return ResponseEntity.ok(
                ApiResponse.success(BrandResponse.fromEntity(brandService.unpause(id))));
    }

    @GetMapping("/influencers")
    public ResponseEntity<ApiResponse<List<InfluencerResponse>>> influencers() {
        return ResponseEntity.ok(
                ApiResponse.success(
                        influencerService.listAll().stream().map(this::toResponse).toList()));
    }

    @PostMapping("/influencers/{id}/pause")
    @Operation(summary = "Pause an influencer, blocking job acceptance")
    public ResponseEntity<ApiResponse<InfluencerResponse>> pauseInfluencer(
            @CurrentUser User admin,
            @PathVariable Long id,
            @Valid @RequestBody PauseRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        toResponse(influencerService.pause(admin, id, request.getReason()))));
    }

    @PostMapping("/influencers/{id}/unpause")
    public ResponseEntity<ApiResponse<InfluencerResponse>> unpauseInfluencer(
            @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(toResponse(influencerService.unpause(id))));
    }

    private InfluencerResponse toResponse(Influencer influencer) {
        List<PlatformConnectionResponse> platforms =
                connectionVerificationService.listConnections(influencer.getId()).stream()
                        .map(PlatformConnectionResponse::fromEntity)
                        .toList();
        return InfluencerResponse.fromEntity(influencer, platforms);
    }
}
