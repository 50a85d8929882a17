package com.pushit.controller;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.pushit.entity.PaymentTransaction;
import com.pushit.entity.TransactionStatus;
import com.pushit.entity.TransactionType;
import com.pushit.exception.ApiException;
import com.pushit.exception.GlobalExceptionHandler;
import com.pushit.service.payment.PaystackService;
import com.pushit.util.Constants;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PaystackWebhookControllerTest {

    private static final String BODY =
            "{\"event\":\"charge.success\",\"data\":{\"reference\":\"WALLET_0A1B2C3D4E5F\"}}";

    private MockMvc mockMvc;

    @Mock private PaystackService paystackService;

    @InjectMocks private PaystackWebhookController controller;

    @BeforeEach
    void setUp() {
        mockMvc =
                MockMvcBuilders.standaloneSetup(controller)
                        .setControllerAdvice(new GlobalExceptionHandler())
                        .build();
    }

    @Test
    void webhook_PassesRawBodyAndSignature() throws Exception {
        mockMvc.perform(
                        post("/api/v1/payments/paystack/webhook")
                                .contentType(MediaType.APPLICATION_JSON)
                                .header(Constants.PAYSTACK_SIGNATURE_HEADER, "abc123")
                                .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        verify(paystackService).handleWebhook(BODY, "abc123");
    }

    @Test
    void webhook_WithoutSignatureHeader_StillReachesService() throws Exception {
        doThrow(
                        new ApiException(
                                "Invalid webhook signature",
                                HttpStatus.BAD_REQUEST,
                                "INVALID_SIGNATURE"))
                .when(paystackService)
                .handleWebhook(eq(BODY), isNull());

        mockMvc.perform(
                        post("/api/v1/payments/paystack/webhook")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_SIGNATURE"));
    }

    @Test
    void callback_ReturnsVerifiedTransaction() throws Exception {
        when(paystackService.verifyTransaction("WALLET_0A1B2C3D4E5F"))
                .thenReturn(
                        PaymentTransaction.builder()
                                .id(9L)
                                .reference("WALLET_0A1B2C3D4E5F")
                                .amount(new BigDecimal("150.50"))
                                .currency("GHS")
                                .type(TransactionType.WALLET_TOPUP)
                                .status(TransactionStatus.SUCCESS)
                                .build());

        mockMvc.perform(
                        get("/api/v1/payments/paystack/callback")
                                .param("reference", "WALLET_0A1B2C3D4E5F"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.reference").value("WALLET_0A1B2C3D4E5F"))
                .andExpect(jsonPath("$.data.status").value("SUCCESS"));
    }

    @Test
    void callback_MissingReference_IsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/payments/paystack/callback"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(paystackService);
    }
}
