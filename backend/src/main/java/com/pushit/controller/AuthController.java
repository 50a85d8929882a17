package com.pushit.controller;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.request.RegisterRequest;
import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.UserResponse;
import com.pushit.entity.User;
import com.pushit.security.CurrentUser;
import com.pushit.service.account.AccountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(API_BASE_PATH + "/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Registration and email verification")
public class AuthController {

    private final AccountService accountService;

    @PostMapping("/register")
    @Operation(summary = "Register a brand or influencer account")
    public ResponseEntity<ApiResponse<UserResponse>> register(
            @Valid @RequestBody RegisterRequest request) {
        User user = accountService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(
                        ApiResponse.success(
                                UserResponse.fromEntity(user),
                                "Check your inbox to verify your email address"));
    }

    @GetMapping("/verify-email")
    @Operation(summary = "Confirm an email address with the emailed token")
    public ResponseEntity<ApiResponse<UserResponse>> verifyEmail(@RequestParam String token) {
        User user = accountService.confirmEmail(token);
        return ResponseEntity.ok(
                ApiResponse.success(UserResponse.fromEntity(user), "Email address verified"));
    }

    @GetMapping("/me")
    @Operation(summary = "Current account")
    public ResponseEntity<ApiResponse<UserResponse>> me(@CurrentUser User user) {
        return ResponseEntity.ok(ApiResponse.success(UserResponse.fromEntity(user)));
    }

    @PostMapping("/resend-verification")
    @Operation(summary = "Send a new verification link")
    public ResponseEntity<ApiResponse<Void>> resendVerification(@CurrentUser User user) {
        accountService.resendVerification(user);
        return ResponseEntity.ok(ApiResponse.success(null, "Verification email sent"));
    }
}
