package com.pushit.controller;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.request.InfluencerProfileRequest;
import com.pushit.dto.request.PaymentMethodRequest;
import com.pushit.dto.request.PlatformConnectionRequest;
import com.pushit.dto.request.ProofRequest;
import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.InfluencerResponse;
import com.pushit.dto.response.JobAcceptanceResponse;
import com.pushit.dto.response.PaymentMethodResponse;
import com.pushit.dto.response.PayoutResponse;
import com.pushit.dto.response.PlatformConnectionResponse;
import com.pushit.dto.response.SubmissionResponse;
import com.pushit.dto.response.WalletSummaryResponse;
import com.pushit.dto.response.WithdrawalResponse;
import com.pushit.entity.Influencer;
import com.pushit.entity.PlatformConnection;
import com.pushit.entity.User;
import com.pushit.security.CurrentUser;
import com.pushit.service.influencer.InfluencerService;
import com.pushit.service.job.JobAcceptanceService;
import com.pushit.service.job.SubmissionService;
import com.pushit.service.payment.PaymentMethodService;
import com.pushit.service.payout.PayoutService;
import com.pushit.service.payout.WithdrawalService;
import com.pushit.service.verification.ConnectionVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(API_BASE_PATH + "/influencers/me")
@RequiredArgsConstructor
@Tag(name = "Influencer", description = "Influencer profile, platforms, jobs and earnings")
public class InfluencerController {

    private final InfluencerService influencerService;
    private final ConnectionVerificationService connectionVerificationService;
    private final JobAcceptanceService jobAcceptanceService;
    private final SubmissionService submissionService;
    private final PayoutService payoutService;
    private final WithdrawalService withdrawalService;
    private final PaymentMethodService paymentMethodService;

    @GetMapping
    public ResponseEntity<ApiResponse<InfluencerResponse>> getProfile(@CurrentUser User user) {
        return ResponseEntity.ok(ApiResponse.success(toResponse(current(user))));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<InfluencerResponse>> updateProfile(
            @CurrentUser User user, @Valid @RequestBody InfluencerProfileRequest request) {
        Influencer influencer = influencerService.updateProfile(user.getId(), request);
        return ResponseEntity.ok(ApiResponse.success(toResponse(influencer)));
    }

    @PostMapping("/complete")
    @Operation(summary = "Mark the profile complete and queue it for verification")
    public ResponseEntity<ApiResponse<InfluencerResponse>> completeProfile(@CurrentUser User user) {
        Influencer influencer = influencerService.completeProfile(user.getId());
        return ResponseEntity.ok(
                ApiResponse.success(
                        toResponse(influencer),
                        "Profile submitted, verification will run in a few minutes"));
    }

    @GetMapping("/platforms")
    public ResponseEntity<ApiResponse<List<PlatformConnectionResponse>>> platforms(
            @CurrentUser User user) {
        return ResponseEntity.ok(ApiResponse.success(connections(current(user).getId())));
    }

    @PostMapping("/platforms")
    @Operation(summary = "Connect a social platform account and score it immediately")
    public ResponseEntity<ApiResponse<PlatformConnectionResponse>> connectPlatform(
            @CurrentUser User user, @Valid @RequestBody PlatformConnectionRequest request) {
        PlatformConnection connection =
                connectionVerificationService.connectPlatform(current(user), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(PlatformConnectionResponse.fromEntity(connection)));
    }

    @PostMapping("/jobs/{campaignId}/accept")
    @Operation(summary = "Accept a job on an active campaign")
    public ResponseEntity<ApiResponse<JobAcceptanceResponse>> acceptJob(
            @CurrentUser User user, @PathVariable Long campaignId) {
        JobAcceptanceService.Acceptance acceptance =
                jobAcceptanceService.acceptJob(current(user), campaignId);
        JobAcceptanceResponse body =
                JobAcceptanceResponse.builder()
                        .submission(SubmissionResponse.fromEntity(acceptance.submission()))
                        .payout(PayoutResponse.fromEntity(acceptance.payout(), LocalDate.now()))
                        .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(body));
    }

    @GetMapping("/submissions")
    public ResponseEntity<ApiResponse<List<SubmissionResponse>>> submissions(
            @CurrentUser User user) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        submissionService.listForInfluencer(current(user).getId()).stream()
                                .map(SubmissionResponse::fromEntity)
                                .toList()));
    }

    @PostMapping("/submissions/{id}/proof")
    public ResponseEntity<ApiResponse<SubmissionResponse>> submitProof(
            @CurrentUser User user,
            @PathVariable Long id,
            @Valid @RequestBody ProofRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        SubmissionResponse.fromEntity(
                                submissionService.submitProof(
                                        current(user), id, request.getProofLink()))));
    }

    @GetMapping("/wallet")
    public ResponseEntity<ApiResponse<WalletSummaryResponse>> wallet(@CurrentUser User user) {
        return ResponseEntity.ok(ApiResponse.success(payoutService.walletSummary(current(user))));
    }

    @GetMapping("/payouts")
    public ResponseEntity<ApiResponse<List<PayoutResponse>>> payouts(@CurrentUser User user) {
        LocalDate today = LocalDate.now();
        return ResponseEntity.ok(
                ApiResponse.success(
                        payoutService.listForInfluencer(current(user).getId()).stream()
                                .map(p -> PayoutResponse.fromEntity(p, today))
                                .toList()));
    }

    @PostMapping("/withdrawals")
    @Operation(summary = "Withdraw the full available balance to the default payment method")
    public ResponseEntity<ApiResponse<WithdrawalResponse>> requestWithdrawal(
            @CurrentUser User user) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(
                        ApiResponse.success(
                                WithdrawalResponse.fromEntity(
                                        withdrawalService.requestWithdrawal(current(user)))));
    }

    @GetMapping("/withdrawals")
    public ResponseEntity<ApiResponse<List<WithdrawalResponse>>> withdrawals(
            @CurrentUser User user) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        withdrawalService.listForInfluencer(current(user).getId()).stream()
                                .map(WithdrawalResponse::fromEntity)
                                .toList()));
    }

    @GetMapping("/payment-methods")
    public ResponseEntity<ApiResponse<List<PaymentMethodResponse>>> paymentMethods(
            @CurrentUser User user) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        paymentMethodService.list(current(user).getId()).stream()
                                .map(PaymentMethodResponse::fromEntity)
                                .toList()));
    }

    @PostMapping("/payment-methods")
    public ResponseEntity<ApiResponse<PaymentMethodResponse>> addPaymentMethod(
            @CurrentUser User user, @Valid @RequestBody PaymentMethodRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(
                        ApiResponse.success(
                                PaymentMethodResponse.fromEntity(
                                        paymentMethodService.add(current(user), request))));
    }

    @PutMapping("/payment-methods/{id}")
    public ResponseEntity<ApiResponse<PaymentMethodResponse>> updatePaymentMethod(
            @CurrentUser User user,
            @PathVariable Long id,
            @Valid @RequestBody PaymentMethodRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        PaymentMethodResponse.fromEntity(
                                paymentMethodService.update(current(user).getId(), id, request))));
    }

    @PostMapping("/payment-methods/{id}/default")
    public ResponseEntity<ApiResponse<PaymentMethodResponse>> setDefaultPaymentMethod(
            @CurrentUser User user, @PathVariable Long id) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        PaymentMethodResponse.fromEntity(
                                paymentMethodService.setDefault(current(user).getId(), id))));
    }

    @DeleteMapping("/payment-methods/{id}")
    public ResponseEntity<ApiResponse<Void>> deletePaymentMethod(
            @CurrentUser User user, @PathVariable Long id) {
        paymentMethodService.delete(current(user).getId(), id);
        return ResponseEntity.ok(ApiResponse.success(null, "Payment method removed"));
    }

    private Influencer current(User user) {
        return influencerService.getByUser(user.getId());
    }

    private List<PlatformConnectionResponse> connections(Long influencerId) {
        return connectionVerificationService.listConnections(influencerId).stream()
                .map(PlatformConnectionResponse::fromEntity)
                .toList();
    }

    private InfluencerResponse toResponse(Influencer influencer) {
        return InfluencerResponse.fromEntity(influencer, connections(influencer.getId()));
    }
}
