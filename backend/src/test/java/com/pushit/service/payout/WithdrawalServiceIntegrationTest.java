package com.pushit.service.payout;

import static org.junit.jupiter.api.Assertions.*;

import com.pushit.entity.Brand;
import com.pushit.entity.Campaign;
import com.pushit.entity.Influencer;
import com.pushit.entity.MobileMoneyNetwork;
import com.pushit.entity.PaymentMethod;
import com.pushit.entity.PaymentMethodType;
import com.pushit.entity.Payout;
import com.pushit.entity.PayoutStatus;
import com.pushit.entity.Platform;
import com.pushit.entity.Submission;
import com.pushit.entity.SubmissionStatus;
import com.pushit.entity.User;
import com.pushit.entity.UserRole;
import com.pushit.entity.WithdrawalRequest;
import com.pushit.exception.InvalidAmountException;
import com.pushit.repository.BrandRepository;
import com.pushit.repository.CampaignRepository;
import com.pushit.repository.InfluencerRepository;
import com.pushit.repository.PaymentMethodRepository;
import com.pushit.repository.PayoutRepository;
import com.pushit.repository.SubmissionRepository;
import com.pushit.repository.UserRepository;
import com.pushit.repository.WithdrawalRequestRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/** Runs without a test transaction so every withdrawal request commits on its own. */
@SpringBootTest
@ActiveProfiles("test")
class WithdrawalServiceIntegrationTest {

    @Autowired private WithdrawalService withdrawalService;

    @Autowired private PayoutService payoutService;

    @Autowired private WithdrawalRequestRepository withdrawalRequestRepository;

    @Autowired private PayoutRepository payoutRepository;

    @Autowired private PaymentMethodRepository paymentMethodRepository;

    @Autowired private SubmissionRepository submissionRepository;

    @Autowired private CampaignRepository campaignRepository;

    @Autowired private InfluencerRepository influencerRepository;

    @Autowired private BrandRepository brandRepository;

    @Autowired private UserRepository userRepository;

    private Influencer influencer;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        User brandUser = userRepository.save(user("brand@withdrawals.test", UserRole.BRAND));
        Brand brand =
                brandRepository.save(
                        Brand.builder().user(brandUser).companyName("Kente Drinks").build());
        campaign =
                campaignRepository.save(
                        Campaign.builder()
                                .brand(brand)
                                .name("Summer push")
                                .platform(Platform.TIKTOK)
                                .packageVideos(2)
                                .budget(new BigDecimal("1000.00"))
                                .currency("GHS")
                                .build());

        User influencerUser =
                userRepository.save(user("creator@withdrawals.test", UserRole.INFLUENCER));
        influencer =
                influencerRepository.save(
                        Influencer.builder().user(influencerUser).displayName("Ama").build());
        paymentMethodRepository.save(
                PaymentMethod.builder()
                        .influencer(influencer)
                        .methodType(PaymentMethodType.MOBILE_MONEY)
                        .mobileMoneyNetwork(MobileMoneyNetwork.MTN)
                        .mobileMoneyNumber("0241234567")
                        .isDefault(true)
                        .build());

        earn("500.00");
    }

    @AfterEach
    void tearDown() {
        payoutRepository.deleteAll();
        withdrawalRequestRepository.deleteAll();
        paymentMethodRepository.deleteAll();
        submissionRepository.deleteAll();
        campaignRepository.deleteAll();
        influencerRepository.deleteAll();
        brandRepository.deleteAll();
        userRepository.deleteAll();
    }

    @Test
    @DisplayName("Earnings claimed by one withdrawal cannot be requested again")
    void requestWithdrawal_SecondRequest_IsRejected() {
        WithdrawalRequest first = withdrawalService.requestWithdrawal(influencer);

        assertEquals(0, new BigDecimal("500.00").compareTo(first.getAmount()));
        assertEquals(0, BigDecimal.ZERO.compareTo(payoutService.availableBalance(influencer)));

        InvalidAmountException ex =
                assertThrows(
                        InvalidAmountException.class,
                        () -> withdrawalService.requestWithdrawal(influencer));
        assertEquals("No funds available for withdrawal", ex.getMessage());
        assertEquals(1, withdrawalRequestRepository.count());
    }

    @Test
    @DisplayName("A later withdrawal only covers payouts earned after the previous one")
    void requestWithdrawal_NewEarnings_OnlyNewPayoutsWithdrawn() {
        withdrawalService.requestWithdrawal(influencer);
        earn("60.00");

        WithdrawalRequest second = withdrawalService.requestWithdrawal(influencer);

        assertEquals(0, new BigDecimal("60.00").compareTo(second.getAmount()));
        assertEquals(2, withdrawalRequestRepository.count());
        assertTrue(payoutRepository.findWithdrawable(influencer.getId()).isEmpty());
    }

    private void earn(String amount) {
        Submission submission =
                submissionRepository.save(
                        Submission.builder()
                                .campaign(campaign)
                                .influencer(influencer)
                                .status(SubmissionStatus.VERIFIED)
                                .build());
        payoutRepository.save(
                Payout.builder()
                        .submission(submission)
                        .influencer(influencer)
                        .campaign(campaign)
                        .amount(new BigDecimal(amount))
                        .currency("GHS")
                        .dueDate(LocalDate.now().plusDays(30))
                        .status(PayoutStatus.PENDING)
                        .build());
    }

    private static User user(String email, UserRole role) {
        return User.builder()
                .email(email)
                .passwordHash("hash")
                .role(role)
                .emailVerified(true)
                .build();
    }
}
