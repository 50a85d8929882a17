package com.pushit.service.campaign;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.pushit.dto.request.CampaignRequest;
import com.pushit.entity.Brand;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.Campaign;
import com.pushit.entity.CampaignStatus;
import com.pushit.entity.Platform;
import com.pushit.exception.ApiException;
import com.pushit.exception.IllegalCampaignStateException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.BrandRepository;
import com.pushit.repository.CampaignRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.wallet.WalletService;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CampaignServiceTest {

    @Mock private CampaignRepository campaignRepository;

    @Mock private BrandRepository brandRepository;

    @Mock private WalletService walletService;

    @Mock private CurrencyService currencyService;

    @InjectMocks private CampaignService campaignService;

    private Brand brand;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        brand =
                Brand.builder()
                        .id(5L)
                        .companyName("Acme Foods")
                        .verificationStatus(BrandVerificationStatus.VERIFIED)
                        .build();
        campaign =
                Campaign.builder()
                        .id(40L)
                        .brand(brand)
                        .name("Jollof launch")
                        .platform(Platform.TIKTOK)
                        .packageVideos(4)
                        .budget(new BigDecimal("400.00"))
                        .currency("GHS")
                        .status(CampaignStatus.DRAFT)
                        .build();

        when(campaignRepository.findById(40L)).thenReturn(Optional.of(campaign));
        when(campaignRepository.save(any(Campaign.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void updateCampaign_SameBudget_EditsOtherFields() {
        CampaignRequest request = request("400.00");
        request.setName("  Jollof relaunch ");
        request.setPackageVideos(6);

        Campaign updated = campaignService.updateCampaign(5L, 40L, request);

        assertEquals("Jollof relaunch", updated.getName());
        assertEquals(6, updated.getPackageVideos());
        assertEquals(new BigDecimal("400.00"), updated.getBudget());
    }

    @Test
    void updateCampaign_ChangedBudgetAfterPayment_IsRejected() {
        ApiException ex =
                assertThrows(
                        ApiException.class,
                        () -> campaignService.updateCampaign(5L, 40L, request("650.00")));

        assertEquals("BUDGET_LOCKED", ex.getErrorCode());
        assertEquals(new BigDecimal("400.00"), campaign.getBudget());
        verify(campaignRepository, never()).save(any());
        verifyNoInteractions(walletService);
    }

    @ParameterizedTest
    @EnumSource(
            value = CampaignStatus.class,
            names = {"ACTIVE", "COMPLETED", "CANCELLED"})
    void updateCampaign_NotEditable_IsConflict(CampaignStatus status) {
        campaign.setStatus(status);

        assertThrows(
                IllegalCampaignStateException.class,
                () -> campaignService.updateCampaign(5L, 40L, request("400.00")));
        verify(campaignRepository, never()).save(any());
    }

    @Test
    void updateCampaign_PausedCampaign_IsEditable() {
        campaign.setStatus(CampaignStatus.PAUSED);

        Campaign updated = campaignService.updateCampaign(5L, 40L, request("400.00"));

        assertEquals(CampaignStatus.PAUSED, updated.getStatus());
    }

    @Test
    void updateCampaign_OtherBrandsCampaign_IsNotFound() {
        assertThrows(
                ResourceNotFoundException.class,
                () -> campaignService.updateCampaign(6L, 40L, request("400.00")));
    }

    @Test
    void pauseCampaign_Active_BecomesPaused() {
        campaign.setStatus(CampaignStatus.ACTIVE);

        assertEquals(CampaignStatus.PAUSED, campaignService.pauseCampaign(5L, 40L).getStatus());
    }

    @Test
    void pauseCampaign_Draft_IsConflict() {
        IllegalCampaignStateException ex =
                assertThrows(
                        IllegalCampaignStateException.class,
                        () -> campaignService.pauseCampaign(5L, 40L));

        assertTrue(ex.getMessage().contains("cannot move from DRAFT to PAUSED"));
        assertEquals(CampaignStatus.DRAFT, campaign.getStatus());
    }

    @Test
    void resumeCampaign_Paused_GoesLiveWithoutCharge() {
        campaign.setStatus(CampaignStatus.PAUSED);

        assertEquals(CampaignStatus.ACTIVE, campaignService.resumeCampaign(5L, 40L).getStatus());
        verifyNoInteractions(walletService);
    }

    @Test
    void resumeCampaign_Draft_IsConflict() {
        assertThrows(
                IllegalCampaignStateException.class,
                () -> campaignService.resumeCampaign(5L, 40L));
    }

    @Test
    void resumeCampaign_PausedBrand_IsForbidden() {
        campaign.setStatus(CampaignStatus.PAUSED);
        brand.setVerificationStatus(BrandVerificationStatus.PAUSED);

        ApiException ex =
                assertThrows(ApiException.class, () -> campaignService.resumeCampaign(5L, 40L));

        assertEquals("ACCOUNT_PAUSED", ex.getErrorCode());
        assertEquals(CampaignStatus.PAUSED, campaign.getStatus());
    }

    @ParameterizedTest
    @EnumSource(
            value = CampaignStatus.class,
            names = {"ACTIVE", "PAUSED"})
    void completeCampaign_LiveOrPaused_BecomesCompleted(CampaignStatus status) {
        campaign.setStatus(status);

        Campaign completed = campaignService.completeCampaign(null, 40L);

        assertEquals(CampaignStatus.COMPLETED, completed.getStatus());
    }

    @Test
    void completeCampaign_Draft_IsConflict() {
        assertThrows(
                IllegalCampaignStateException.class,
                () -> campaignService.completeCampaign(5L, 40L));
    }

    @ParameterizedTest
    @EnumSource(
            value = CampaignStatus.class,
            names = {"DRAFT", "PAUSED"})
    void cancelCampaign_DraftOrPaused_CancelledWithoutRefund(CampaignStatus status) {
        campaign.setStatus(status);

        assertEquals(
                CampaignStatus.CANCELLED, campaignService.cancelCampaign(5L, 40L).getStatus());
        verifyNoInteractions(walletService);
    }

    @ParameterizedTest
    @EnumSource(
            value = CampaignStatus.class,
            names = {"ACTIVE", "COMPLETED", "CANCELLED"})
    void cancelCampaign_FromOtherStates_IsConflict(CampaignStatus status) {
        campaign.setStatus(status);

        assertThrows(
                IllegalCampaignStateException.class,
                () -> campaignService.cancelCampaign(5L, 40L));
        assertEquals(status, campaign.getStatus());
    }

    @Test
    void completedCampaign_AcceptsNoFurtherTransition() {
        campaign.setStatus(CampaignStatus.COMPLETED);

        assertThrows(
                IllegalCampaignStateException.class,
                () -> campaignService.pauseCampaign(5L, 40L));
        assertThrows(
                IllegalCampaignStateException.class,
                () -> campaignService.resumeCampaign(5L, 40L));
        assertThrows(
                IllegalCampaignStateException.class,
                () -> campaignService.activateCampaign(5L, 40L));
    }

    private static CampaignRequest request(String budget) {
        return CampaignPaymentIntegrationTest.request(budget);
    }
}
