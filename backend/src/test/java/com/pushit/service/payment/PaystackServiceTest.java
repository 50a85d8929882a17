package com.pushit.service.payment;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pushit.client.PaystackClient;
import com.pushit.config.AppProperties;
import com.pushit.dto.response.TopUpResponse;
import com.pushit.entity.Brand;
import com.pushit.entity.PaymentTransaction;
import com.pushit.entity.TransactionStatus;
import com.pushit.entity.TransactionType;
import com.pushit.entity.User;
import com.pushit.exception.ApiException;
import com.pushit.exception.InvalidAmountException;
import com.pushit.exception.PaymentGatewayException;
import com.pushit.repository.PaymentTransactionRepository;
import com.pushit.service.wallet.WalletService;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaystackServiceTest {

    private static final String SECRET = "sk_test_secret";

    @Mock private PaystackClient paystackClient;

    @Mock private PaymentTransactionRepository transactionRepository;

    @Mock private WalletService walletService;

    private PaystackService paystackService;

    @BeforeEach
    void setUp() {
        paystackService = service(SECRET);
        when(transactionRepository.save(any(PaymentTransaction.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private PaystackService service(String secret) {
        AppProperties defaults = AppProperties.defaults();
        AppProperties properties =
                new AppProperties(
                        defaults.verification(),
                        defaults.integrations(),
                        new AppProperties.Paystack(
                                secret, "pk_test", "https://api.paystack.co", "http://cb"),
                        defaults.wallet(),
                        defaults.email());
        return new PaystackService(
                paystackClient,
                transactionRepository,
                walletService,
                new ObjectMapper(),
                properties);
    }

    private PaymentTransaction pendingTopUp(String reference, String amount) {
        PaymentTransaction transaction =
                PaymentTransaction.builder()
                        .reference(reference)
                        .amount(new BigDecimal(amount))
                        .currency("GHS")
                        .type(TransactionType.WALLET_TOPUP)
                        .status(TransactionStatus.PENDING)
                        .build();
        when(transactionRepository.findByReferenceWithLock(reference))
                .thenReturn(Optional.of(transaction));
        return transaction;
    }

    private static String chargeEvent(String event, String reference, long amountMinor) {
        return "{\"event\":\""
                + event
                + "\",\"data\":{\"reference\":\""
                + reference
                + "\",\"amount\":"
                + amountMinor
                + ",\"authorization\":{\"authorization_code\":\"AUTH_x1\"},"
                + "\"customer\":{\"customer_code\":\"CUS_y2\"}}}";
    }

    @Test
    void sign_MatchesHmacSha512Hex() {
        assertEquals(
                "d2c20958e71984927bee0613f77fa295c3fa82f681cebac2f292d603fbc0ec52"
                        + "d7302b91f7beb43b3e289b0cee9b9867daf70f7a5b1af70eb4d8da1909b5fd36",
                PaystackService.sign("{\"event\":\"charge.success\"}", SECRET));
    }

    @Test
    void isValidSignature_AcceptsExactSignatureInAnyCase() {
        String body = "{\"event\":\"charge.success\"}";
        String signature = PaystackService.sign(body, SECRET);

        assertTrue(paystackService.isValidSignature(body, signature));
        assertTrue(paystackService.isValidSignature(body, signature.toUpperCase(Locale.ROOT)));
    }

    @Test
    void isValidSignature_RejectsTamperedBodyAndMissingSignature() {
        String signature = PaystackService.sign("{\"amount\":100}", SECRET);

        assertFalse(paystackService.isValidSignature("{\"amount\":1000}", signature));
        assertFalse(paystackService.isValidSignature("{\"amount\":100}", null));
        assertFalse(paystackService.isValidSignature("{\"amount\":100}", " "));
    }

    @Test
    void isValidSignature_WithoutConfiguredSecret_RejectsEverything() {
        PaystackService unconfigured = service(null);
        String body = "{}";

        assertFalse(unconfigured.isValidSignature(body, PaystackService.sign(body, SECRET)));
    }

    @Test
    void handleWebhook_BadSignature_Returns400AndProcessesNothing() {
        String body = chargeEvent("charge.success", "WALLET_ABC", 10000);

        ApiException ex =
                assertThrows(
                        ApiException.class,
                        () -> paystackService.handleWebhook(body, "deadbeef"));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        assertEquals("INVALID_SIGNATURE", ex.getErrorCode());
        verifyNoInteractions(transactionRepository, walletService);
    }

    @Test
    void handleWebhook_MalformedJson_Returns400() {
        String body = "{not json";

        ApiException ex =
                assertThrows(
                        ApiException.class,
                        () ->
                                paystackService.handleWebhook(
                                        body, PaystackService.sign(body, SECRET)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        assertEquals("MALFORMED_JSON", ex.getErrorCode());
    }

    @Test
    void handleWebhook_ChargeSuccess_MarksPaidAndCreditsWallet() {
        PaymentTransaction transaction = pendingTopUp("WALLET_ABC", "100.00");
        String body = chargeEvent("charge.success", "WALLET_ABC", 10000);

        paystackService.handleWebhook(body, PaystackService.sign(body, SECRET));

        assertEquals(TransactionStatus.SUCCESS, transaction.getStatus());
        assertEquals("AUTH_x1", transaction.getAuthorizationCode());
        assertEquals("CUS_y2", transaction.getCustomerCode());
        assertNotNull(transaction.getPaidAt());
        verify(walletService).creditTopUp(transaction);
    }

    @Test
    void handleWebhook_ChargeSuccess_MatchingAmountLeavesNoFlag() {
        PaymentTransaction transaction = pendingTopUp("WALLET_ABC", "100.00");
        String body = chargeEvent("charge.success", "WALLET_ABC", 10000);

        paystackService.handleWebhook(body, PaystackService.sign(body, SECRET));

        assertEquals(new BigDecimal("100.00"), transaction.getAmount());
        assertNull(transaction.getMetadata());
    }

    @Test
    void handleWebhook_AmountDiffersFromRequest_CreditsVerifiedAmountAndFlags() throws Exception {
        PaymentTransaction transaction = pendingTopUp("WALLET_ABC", "500.00");
        String body = chargeEvent("charge.success", "WALLET_ABC", 45000);

        paystackService.handleWebhook(body, PaystackService.sign(body, SECRET));

        assertEquals(TransactionStatus.SUCCESS, transaction.getStatus());
        assertEquals(new BigDecimal("450.00"), transaction.getAmount());
        JsonNode metadata = new ObjectMapper().readTree(transaction.getMetadata());
        assertEquals(PaystackService.AMOUNT_MISMATCH, metadata.get("flag").asText());
        assertEquals("500.00", metadata.get("requestedAmount").asText());
        assertEquals("450.00", metadata.get("verifiedAmount").asText());
        verify(walletService)
                .creditTopUp(argThat(t -> new BigDecimal("450.00").equals(t.getAmount())));
    }

    @Test
    void handleWebhook_RedeliveredSuccess_IsIgnored() {
        PaymentTransaction transaction = pendingTopUp("WALLET_ABC", "100.00");
        transaction.setStatus(TransactionStatus.SUCCESS);
        String body = chargeEvent("charge.success", "WALLET_ABC", 10000);

        paystackService.handleWebhook(body, PaystackService.sign(body, SECRET));

        verify(walletService, never()).creditTopUp(any());
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void handleWebhook_ChargeFailed_MarksFailedWithoutCredit() {
        PaymentTransaction transaction = pendingTopUp("WALLET_DEF", "50.00");
        String body = chargeEvent("charge.failed", "WALLET_DEF", 5000);

        paystackService.handleWebhook(body, PaystackService.sign(body, SECRET));

        assertEquals(TransactionStatus.FAILED, transaction.getStatus());
        verify(walletService, never()).creditTopUp(any());
    }

    @Test
    void handleWebhook_UnknownReference_IsAcknowledged() {
        when(transactionRepository.findByReferenceWithLock("NOPE")).thenReturn(Optional.empty());
        String body = chargeEvent("charge.success", "NOPE", 100);

        assertDoesNotThrow(
                () -> paystackService.handleWebhook(body, PaystackService.sign(body, SECRET)));
        verify(walletService, never()).creditTopUp(any());
    }

    @Test
    void handleWebhook_OtherEventsAreIgnored() {
        String body = chargeEvent("transfer.success", "TRF_1", 100);

        paystackService.handleWebhook(body, PaystackService.sign(body, SECRET));

        verifyNoInteractions(transactionRepository, walletService);
    }

    @Test
    void initializeTopUp_SendsMinorUnitsAndStoresPendingTransaction() {
        User user = User.builder().id(1L).email("brand@acme.com").build();
        Brand brand = Brand.builder().id(2L).user(user).build();
        when(walletService.walletCurrency(brand)).thenReturn("GHS");
        when(paystackClient.initialize(
                        eq("brand@acme.com"), eq(15050L), eq("GHS"), anyString(), anyMap()))
                .thenReturn(
                        new PaystackClient.Initialization(
                                "https://checkout.paystack.com/abc", "abc", "ignored"));

        TopUpResponse response = paystackService.initializeTopUp(brand, new BigDecimal("150.5"));

        ArgumentCaptor<PaymentTransaction> saved =
                ArgumentCaptor.forClass(PaymentTransaction.class);
        verify(transactionRepository).save(saved.capture());
        assertEquals(TransactionStatus.PENDING, saved.getValue().getStatus());
        assertEquals(TransactionType.WALLET_TOPUP, saved.getValue().getType());
        assertEquals(new BigDecimal("150.50"), saved.getValue().getAmount());
        assertEquals(saved.getValue().getReference(), response.getReference());
        assertTrue(response.getReference().startsWith("WALLET_"));
        assertEquals("https://checkout.paystack.com/abc", response.getAuthorizationUrl());
    }

    @Test
    void initializeTopUp_NonPositiveAmount_IsRejected() {
        Brand brand = Brand.builder().id(2L).build();

        assertThrows(
                InvalidAmountException.class,
                () -> paystackService.initializeTopUp(brand, BigDecimal.ZERO));
        verifyNoInteractions(paystackClient);
    }

    @Test
    void initializeTopUp_MalformedSecretKey_IsRejectedBeforeCallingPaystack() {
        PaystackService misconfigured = service("pk_live_wrong_key");
        Brand brand = Brand.builder().id(2L).build();

        assertThrows(
                PaymentGatewayException.class,
                () -> misconfigured.initializeTopUp(brand, new BigDecimal("10")));
        verifyNoInteractions(paystackClient);
    }

    @Test
    void verifyTransaction_AbandonedCheckout_MarksFailed() {
        PaymentTransaction transaction = pendingTopUp("WALLET_GHI", "20.00");
        when(paystackClient.verify("WALLET_GHI"))
                .thenReturn(
                        new PaystackClient.Verification(
                                "abandoned", "WALLET_GHI", 2000, "GHS", null, null));

        PaymentTransaction result = paystackService.verifyTransaction("WALLET_GHI");

        assertSame(transaction, result);
        assertEquals(TransactionStatus.FAILED, result.getStatus());
    }
}
