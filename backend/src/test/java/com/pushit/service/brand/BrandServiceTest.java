package com.pushit.service.brand;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.pushit.entity.Brand;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.QueueSubjectType;
import com.pushit.entity.User;
import com.pushit.entity.UserRole;
import com.pushit.exception.ApiException;
import com.pushit.repository.BrandRepository;
import com.pushit.service.currency.CurrencyService;
import com.pushit.service.queue.VerificationQueueService;
import java.time.LocalDateTime;
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
class BrandServiceTest {

    @Mock private BrandRepository brandRepository;

    @Mock private CurrencyService currencyService;

    @Mock private VerificationQueueService verificationQueueService;

    @InjectMocks private BrandService brandService;

    private final User admin = User.builder().id(1L).role(UserRole.ADMIN).build();
    private Brand brand;

    @BeforeEach
    void setUp() {
        brand =
                Brand.builder()
                        .id(5L)
                        .companyName("Acme Foods")
                        .industry("Food & Beverage")
                        .description("Ready meals for busy families across Accra.")
                        .contactEmail("hello@acme.test")
                        .build();

        when(brandRepository.findByUserId(50L)).thenReturn(Optional.of(brand));
        when(brandRepository.findById(5L)).thenReturn(Optional.of(brand));
        when(brandRepository.save(any(Brand.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void completeProfile_AllFieldsPresent_QueuesVerification() {
        Brand completed = brandService.completeProfile(50L);

        assertTrue(completed.isProfileCompleted());
        verify(verificationQueueService).schedule(QueueSubjectType.BRAND, 5L);
    }

    @Test
    void completeProfile_PhoneInsteadOfEmail_IsEnough() {
        brand.setContactEmail(null);
        brand.setPhoneNumber("+233241234567");

        assertTrue(brandService.completeProfile(50L).isProfileCompleted());
    }

    @Test
    void completeProfile_MissingFields_ListsThemAndQueuesNothing() {
        brand.setIndustry(" ");
        brand.setContactEmail(null);

        ApiException ex =
                assertThrows(ApiException.class, () -> brandService.completeProfile(50L));

        assertEquals("PROFILE_INCOMPLETE", ex.getErrorCode());
        assertEquals(
                "Profile is incomplete, missing: industry, contactEmail or phoneNumber",
                ex.getMessage());
        assertFalse(brand.isProfileCompleted());
        verifyNoInteractions(verificationQueueService);
    }

    @Test
    void pause_RecordsWhoWhenAndWhy() {
        Brand paused = brandService.pause(admin, 5L, "Chargeback dispute");

        assertEquals(BrandVerificationStatus.PAUSED, paused.getVerificationStatus());
        assertSame(admin, paused.getPausedBy());
        assertNotNull(paused.getPausedAt());
        assertEquals("Chargeback dispute", paused.getPauseReason());
    }

    @Test
    void unpause_CompletedProfile_BackToPendingAndRequeued() {
        brand.setProfileCompleted(true);
        brand.setVerificationStatus(BrandVerificationStatus.PAUSED);
        brand.setPausedBy(admin);
        brand.setPausedAt(LocalDateTime.now());
        brand.setPauseReason("Chargeback dispute");

        Brand resumed = brandService.unpause(5L);

        assertEquals(BrandVerificationStatus.PENDING, resumed.getVerificationStatus());
        assertNull(resumed.getPausedBy());
        assertNull(resumed.getPausedAt());
        assertNull(resumed.getPauseReason());
        verify(verificationQueueService).schedule(QueueSubjectType.BRAND, 5L);
    }

    @Test
    void unpause_IncompleteProfile_NotRequeued() {
        brand.setVerificationStatus(BrandVerificationStatus.PAUSED);

        brandService.unpause(5L);

        verifyNoInteractions(verificationQueueService);
    }

    @Test
    void unpause_NotPaused_IsConflict() {
        brand.setVerificationStatus(BrandVerificationStatus.VERIFIED);

        ApiException ex = assertThrows(ApiException.class, () -> brandService.unpause(5L));

        assertEquals("NOT_PAUSED", ex.getErrorCode());
        assertEquals(BrandVerificationStatus.VERIFIED, brand.getVerificationStatus());
        verify(brandRepository, never()).save(any());
    }
}
