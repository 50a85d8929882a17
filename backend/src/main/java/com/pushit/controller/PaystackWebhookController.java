package com.pushit.controller;

import static com.pushit.util.Constants.API_BASE_PATH;
import static com.pushit.util.Constants.PAYSTACK_SIGNATURE_HEADER;

import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.TransactionResponse;
import com.pushit.entity.PaymentTransaction;
import com.pushit.service.payment.PaystackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping(API_BASE_PATH + "/payments/paystack")
@RequiredArgsConstructor
@Tag(name = "Paystack", description = "Payment gateway callbacks")
public class PaystackWebhookController {

    private final PaystackService paystackService;

    /**
     * Paystack event delivery. The signature is computed over the exact bytes received, so the body
     * is taken as a raw string and only parsed after verification.
     */
    @PostMapping("/webhook")
    @Operation(summary = "Receive Paystack events")
    public ResponseEntity<Map<String, String>> webhook(
            @RequestBody String rawBody,
            @RequestHeader(value = PAYSTACK_SIGNATURE_HEADER, required = false) String signature) {
        log.debug("Paystack webhook received, {} bytes", rawBody.length());
        paystackService.handleWebhook(rawBody, signature);
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    @GetMapping("/callback")
    @Operation(summary = "Checkout return URL, confirms the transaction with Paystack")
    public ResponseEntity<ApiResponse<TransactionResponse>> callback(
            @RequestParam String reference) {
        PaymentTransaction transaction = paystackService.verifyTransaction(reference);
        return ResponseEntity.ok(ApiResponse.success(TransactionResponse.fromEntity(transaction)));
    }
}
