package com.pushit.controller.admin;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.request.ReviewRequest;
import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.BrandResponse;
import com.pushit.dto.response.InfluencerResponse;
import com.pushit.dto.response.PlatformConnectionResponse;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.Influencer;
import com.pushit.entity.InfluencerVerificationStatus;
import com.pushit.service.brand.BrandService;
import com.pushit.service.influencer.InfluencerService;
import com.pushit.service.queue.DrainStats;
import com.pushit.service.queue.VerificationQueueService;
import com.pushit.service.verification.BatchVerificationStats;
import com.pushit.service.verification.BrandVerificationService;
import com.pushit.service.verification.ConnectionVerificationService;
import com.pushit.service.verification.VerificationResult;
import com.pushit.util.DecisionParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Verification queue operations and manual review of brands, influencers and connections. */
@Slf4j
@RestController
@RequestMapping(API_BASE_PATH + "/admin/verification")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Verification")
public class AdminVerificationController {

    private static final EnumSet<BrandVerificationStatus> BRAND_DECISIONS =
            EnumSet.of(
                    BrandVerificationStatus.VERIFIED,
                    BrandVerificationStatus.REJECTED,
                    BrandVerificationStatus.REQUEST_INFO);
    private static final EnumSet<InfluencerVerificationStatus> INFLUENCER_DECISIONS =
            EnumSet.of(
                    InfluencerVerificationStatus.APPROVED,
                    InfluencerVerificationStatus.REJECTED,
                    InfluencerVerificationStatus.REQUEST_INFO);

    private enum ConnectionDecision {
        APPROVE,
        REJECT
    }

    private final VerificationQueueService verificationQueueService;
    private final ConnectionVerificationService connectionVerificationService;
    private final BrandVerificationService brandVerificationService;
    private final BrandService brandService;
    private final InfluencerService influencerService;

    @PostMapping("/queue/drain")
    @Operation(summary = "Process due verification queue entries now")
    public ResponseEntity<ApiResponse<DrainStats>> drainQueue() {
        DrainStats stats = verificationQueueService.drain();
        log.info("Manual queue drain: {}", stats);
        return ResponseEntity.ok(ApiResponse.success(stats));
    }

    @GetMapping("/queue/backlog")
    public ResponseEntity<ApiResponse<Map<String, Long>>> backlog() {
        return ResponseEntity.ok(
                ApiResponse.success(Map.of("unprocessed", verificationQueueService.backlog())));
    }

    @PostMapping("/connections/batch")
    @Operation(summary = "Re-score pending platform connections, oldest first")
    public ResponseEntity<ApiResponse<BatchVerificationStats>> batchVerify(
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > 500) {
            throw new IllegalArgumentException("limit must be between 1 and 500");
        }
        return ResponseEntity.ok(
                ApiResponse.success(connectionVerificationService.batchVerifyPending(limit)));
    }

    @GetMapping("/connections/suspicious")
    @Operation(summary = "Connections with follower and engagement patterns worth a manual look")
    public ResponseEntity<ApiResponse<List<PlatformConnectionResponse>>> suspicious() {
        return ResponseEntity.ok(
                ApiResponse.success(
                        connectionVerificationService.flagSuspiciousConnections().stream()
                                .map(PlatformConnectionResponse::fromEntity)
                                .toList()));
    }

    @PostMapping("/connections/{id}/review")
    public ResponseEntity<ApiResponse<PlatformConnectionResponse>> reviewConnection(
            @PathVariable Long id, @Valid @RequestBody ReviewRequest request) {
        ConnectionDecision decision =
                DecisionParser.parse(
                        ConnectionDecision.class,
                        request.getDecision(),
                        EnumSet.allOf(ConnectionDecision.class));
        return ResponseEntity.ok(
                ApiResponse.success(
                        PlatformConnectionResponse.fromEntity(
                                connectionVerificationService.reviewConnection(
                                        id,
                                        decision == ConnectionDecision.APPROVE,
                                        request.getNotes()))));
    }

    @PostMapping("/brands/{id}/run")
    @Operation(summary = "Score a brand immediately, bypassing the queue delay")
    public ResponseEntity<ApiResponse<VerificationResult>> runBrandVerification(
            @PathVariable Long id) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        brandVerificationService.verifyBrand(brandService.getById(id))));
    }

    @PostMapping("/brands/{id}/review")
    public ResponseEntity<ApiResponse<BrandResponse>> reviewBrand(
            @PathVariable Long id, @Valid @RequestBody ReviewRequest request) {
        BrandVerificationStatus decision =
                DecisionParser.parse(
                        BrandVerificationStatus.class, request.getDecision(), BRAND_DECISIONS);
        return ResponseEntity.ok(
                ApiResponse.success(
                        BrandResponse.fromEntity(
                                brandVerificationService.reviewBrand(
                                        id, decision, request.getNotes()))));
    }

    @PostMapping("/influencers/{id}/review")
    public ResponseEntity<ApiResponse<InfluencerResponse>> reviewInfluencer(
            @PathVariable Long id, @Valid @RequestBody ReviewRequest request) {
        InfluencerVerificationStatus decision =
                DecisionParser.parse(
                        InfluencerVerificationStatus.class,
                        request.getDecision(),
                        INFLUENCER_DECISIONS);
        Influencer influencer = influencerService.review(id, decision, request.getNotes());
        List<PlatformConnectionResponse> platforms =
                connectionVerificationService.listConnections(id).stream()
                        .map(PlatformConnectionResponse::fromEntity)
                        .toList();
        return ResponseEntity.ok(
                ApiResponse.success(InfluencerResponse.fromEntity(influencer, platforms)));
    }
}
