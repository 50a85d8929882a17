package com.pushit.controller.admin;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.request.PayoutUpdateRequest;
import com.pushit.dto.request.ReviewRequest;
import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.PayoutResponse;
import com.pushit.dto.response.SubmissionResponse;
import com.pushit.entity.SubmissionStatus;
import com.pushit.entity.User;
import com.pushit.security.CurrentUser;
import com.pushit.service.job.ReviewAction;
import com.pushit.service.job.SubmissionService;
import com.pushit.service.payout.PayoutService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Submission review and manual payout settlement. */
@RestController
@RequestMapping(API_BASE_PATH + "/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Submissions and Payouts")
public class AdminWorkController {

    private final SubmissionService submissionService;
    private final PayoutService payoutService;

    @GetMapping("/submissions")
    public ResponseEntity<ApiResponse<List<SubmissionResponse>>> submissions(
            @RequestParam(defaultValue = "IN_REVIEW") SubmissionStatus status) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        submissionService.listByStatus(status).stream()
                                .map(SubmissionResponse::fromEntity)
                                .toList()));
    }

    @PostMapping("/submissions/{id}/review")
    @Operation(summary = "Approve, reject (request re-upload) or flag a submission")
    public ResponseEntity<ApiResponse<SubmissionResponse>> reviewSubmission(
            @CurrentUser User admin,
            @PathVariable Long id,
            @Valid @RequestBody ReviewRequest request) {
        ReviewAction action = ReviewAction.parse(request.getDecision());
        return ResponseEntity.ok(
                ApiResponse.success(
                        SubmissionResponse.fromEntity(
                                submissionService.reviewSubmission(
                                        admin, id, action, request.getNotes()))));
    }

    @GetMapping("/payouts/overdue")
    public ResponseEntity<ApiResponse<List<PayoutResponse>>> overduePayouts() {
        LocalDate today = LocalDate.now();
        return ResponseEntity.ok(
                ApiResponse.success(
                        payoutService.overduePayouts().stream()
                                .map(p -> PayoutResponse.fromEntity(p, today))
                                .toList()));
    }

    @PostMapping("/payouts/{id}/sent")
    @Operation(summary = "Record an off-platform transfer to the influencer")
    public ResponseEntity<ApiResponse<PayoutResponse>> markSent(
            @CurrentUser User admin,
            @PathVariable Long id,
            @Valid @RequestBody PayoutUpdateRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        PayoutResponse.fromEntity(
                                payoutService.markPayoutSent(
                                        admin, id, request.getReference(), request.getNotes()),
                                LocalDate.now())));
    }

    @PostMapping("/payouts/{id}/failed")
    public ResponseEntity<ApiResponse<PayoutResponse>> markFailed(
            @CurrentUser User admin,
            @PathVariable Long id,
            @Valid @RequestBody PayoutUpdateRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        PayoutResponse.fromEntity(
                                payoutService.markPayoutFailed(admin, id, request.getNotes()),
                                LocalDate.now())));
    }
}
