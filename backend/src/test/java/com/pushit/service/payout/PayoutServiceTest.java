package com.pushit.service.payout;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.pushit.dto.response.WalletSummaryResponse;
import com.pushit.entity.Campaign;
import com.pushit.entity.Currency;
import com.pushit.entity.Influencer;
import com.pushit.entity.NotificationType;
import com.pushit.entity.Payout;
import com.pushit.entity.PayoutStatus;
import com.pushit.entity.Submission;
import com.pushit.entity.SubmissionStatus;
import com.pushit.entity.User;
import com.pushit.entity.UserRole;
import com.pushit.entity.WithdrawalRequest;
import com.pushit.exception.ApiException;
import com.pushit.repository.PayoutRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.notification.NotificationService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PayoutServiceTest {

    @Mock private PayoutRepository payoutRepository;

    @Mock private CurrencyService currencyService;

    @Mock private NotificationService notificationService;

    @InjectMocks private PayoutService payoutService;

    private final User admin = User.builder().id(1L).role(UserRole.ADMIN).build();
    private final User influencerUser = User.builder().id(2L).role(UserRole.INFLUENCER).build();
    private Influencer influencer;
    private Payout payout;

    @BeforeEach
    void setUp() {
        influencer =
                Influencer.builder()
                        .id(7L)
                        .user(influencerUser)
                        .currency(Currency.builder().code("GHS").build())
                        .build();
        payout =
                Payout.builder()
                        .id(90L)
                        .influencer(influencer)
                        .submission(
                                Submission.builder()
                                        .id(80L)
                                        .status(SubmissionStatus.VERIFIED)
                                        .build())
                        .amount(new BigDecimal("250.00"))
                        .currency("GHS")
                        .status(PayoutStatus.PENDING)
                        .build();

        when(payoutRepository.findById(90L)).thenReturn(Optional.of(payout));
        when(payoutRepository.save(any(Payout.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(currencyService.format(any(BigDecimal.class), anyString())).thenReturn("GH₵250.00");
        when(currencyService.convert(any(BigDecimal.class), anyString(), anyString()))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void markPayoutSent_RecordsReferenceAndNotifiesInfluencer() {
        Payout sent = payoutService.markPayoutSent(admin, 90L, "MOMO-123", "Paid via MTN");

        assertEquals(PayoutStatus.SENT, sent.getStatus());
        assertEquals("MOMO-123", sent.getReference());
        assertSame(admin, sent.getSentBy());
        assertNotNull(sent.getSentAt());
        verify(notificationService)
                .notify(
                        eq(influencerUser),
                        eq(NotificationType.PAYOUT_SENT),
                        anyString(),
                        contains("GH₵250.00"),
                        eq(80L),
                        eq(90L));
    }

    @Test
    void markPayoutSent_AlreadySent_IsConflict() {
        payout.setStatus(PayoutStatus.SENT);

        ApiException ex =
                assertThrows(
                        ApiException.class,
                        () -> payoutService.markPayoutSent(admin, 90L, "MOMO-123", null));
        assertEquals("PAYOUT_NOT_PENDING", ex.getErrorCode());
        verifyNoInteractions(notificationService);
    }

    @Test
    void markPayoutFailed_PendingPayout_BecomesFailed() {
        Payout failed = payoutService.markPayoutFailed(admin, 90L, "Wrong number");

        assertEquals(PayoutStatus.FAILED, failed.getStatus());
        assertEquals("Wrong number", failed.getNotes());
    }

    @Test
    void markPayoutFailed_SentPayout_IsRejected() {
        payout.setStatus(PayoutStatus.SENT);

        assertThrows(
                ApiException.class, () -> payoutService.markPayoutFailed(admin, 90L, "late"));
    }

    @Test
    void availableBalance_SumsWithdrawablePayouts() {
        Payout second =
                Payout.builder()
                        .amount(new BigDecimal("125.50"))
                        .currency("GHS")
                        .status(PayoutStatus.PENDING)
                        .build();
        when(payoutRepository.findWithdrawable(7L)).thenReturn(List.of(payout, second));

        assertEquals(new BigDecimal("375.50"), payoutService.availableBalance(influencer));
    }

    @Test
    void availableBalance_NothingWithdrawable_IsZero() {
        when(payoutRepository.findWithdrawable(7L)).thenReturn(List.of());

        assertEquals(BigDecimal.ZERO, payoutService.availableBalance(influencer));
    }

    @Test
    void claimForWithdrawal_LinksEveryPayoutToRequest() {
        WithdrawalRequest request = WithdrawalRequest.builder().id(300L).build();

        payoutService.claimForWithdrawal(List.of(payout), request);

        assertSame(request, payout.getWithdrawalRequest());
        verify(payoutRepository).saveAll(List.of(payout));
    }

    @Test
    void walletSummary_TotalsEachBucketInSettlementCurrency() {
        LocalDate today = LocalDate.now();
        Payout overdue = payout(91L, "250.00", PayoutStatus.PENDING, today.minusDays(2));
        Payout clearing = payout(92L, "100.00", PayoutStatus.PENDING, today.plusDays(20));
        Payout sent = payout(93L, "300.00", PayoutStatus.SENT, today.minusDays(10));
        when(payoutRepository.findWithdrawable(7L)).thenReturn(List.of(overdue));
        when(payoutRepository.findPendingByInfluencerAndSubmissionStatus(
                        7L, EnumSet.of(SubmissionStatus.NEW, SubmissionStatus.IN_REVIEW)))
                .thenReturn(List.of(clearing));
        when(payoutRepository.findByInfluencerIdAndStatus(7L, PayoutStatus.SENT))
                .thenReturn(List.of(sent));
        when(payoutRepository.findByInfluencerIdOrderByCreatedAtDesc(7L))
                .thenReturn(List.of(clearing, overdue, sent));

        WalletSummaryResponse summary = payoutService.walletSummary(influencer);

        assertEquals("GHS", summary.getCurrency());
        assertEquals(new BigDecimal("250.00"), summary.getAvailable());
        assertEquals(new BigDecimal("100.00"), summary.getPendingClearance());
        assertEquals(new BigDecimal("300.00"), summary.getTotalEarned());
        assertEquals(1, summary.getOverdueCount());
        assertEquals(3, summary.getRecentPayouts().size());
        assertTrue(summary.getRecentPayouts().get(1).isOverdue());
        assertFalse(summary.getRecentPayouts().get(2).isOverdue());
    }

    @Test
    void walletSummary_ConvertsForeignPayouts() {
        Payout naira = payout(94L, "10000.00", PayoutStatus.PENDING, LocalDate.now());
        naira.setCurrency("NGN");
        when(currencyService.convert(new BigDecimal("10000.00"), "NGN", "GHS"))
                .thenReturn(new BigDecimal("96.00"));
        when(payoutRepository.findWithdrawable(7L)).thenReturn(List.of(naira));

        WalletSummaryResponse summary = payoutService.walletSummary(influencer);

        assertEquals(new BigDecimal("96.00"), summary.getAvailable());
        assertEquals(BigDecimal.ZERO, summary.getPendingClearance());
    }

    @Test
    void overduePayouts_QueriesWithToday() {
        Payout late = payout(95L, "80.00", PayoutStatus.PENDING, LocalDate.now().minusDays(1));
        when(payoutRepository.findOverdue(LocalDate.now())).thenReturn(List.of(late));

        List<Payout> overdue = payoutService.overduePayouts();

        assertEquals(List.of(late), overdue);
        verify(payoutRepository).findOverdue(LocalDate.now());
    }

    private Payout payout(Long id, String amount, PayoutStatus status, LocalDate dueDate) {
        return Payout.builder()
                .id(id)
                .influencer(influencer)
                .campaign(Campaign.builder().id(40L).build())
                .submission(Submission.builder().id(id + 100).build())
                .amount(new BigDecimal(amount))
                .currency("GHS")
                .status(status)
                .dueDate(dueDate)
                .build();
    }
}
