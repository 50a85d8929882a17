package com.pushit.service.queue;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.pushit.config.AppProperties;
import com.pushit.entity.Brand;
import com.pushit.entity.BrandVerificationStatus;
import com.pushit.entity.Influencer;
import com.pushit.entity.InfluencerVerificationStatus;
import com.pushit.entity.QueueSubjectType;
import com.pushit.entity.VerificationQueueEntry;
import com.pushit.monitoring.VerificationMetrics;
import com.pushit.repository.BrandRepository;
import com.pushit.repository.InfluencerRepository;
import com.pushit.repository.VerificationQueueRepository;
import com.pushit.service.verification.BrandVerificationService;
import com.pushit.service.verification.ConnectionVerificationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class VerificationQueueServiceTest {

    @Mock private VerificationQueueRepository queueRepository;

    @Mock private BrandRepository brandRepository;

    @Mock private InfluencerRepository influencerRepository;

    @Mock private BrandVerificationService brandVerificationService;

    @Mock private ConnectionVerificationService connectionVerificationService;

    @Mock private TransactionTemplate transactionTemplate;

    private SimpleMeterRegistry meterRegistry;
    private VerificationQueueService queueService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queueService =
                new VerificationQueueService(
                        queueRepository,
                        brandRepository,
                        influencerRepository,
                        brandVerificationService,
                        connectionVerificationService,
                        new VerificationMetrics(meterRegistry),
                        transactionTemplate,
                        AppProperties.defaults());

        when(transactionTemplate.execute(any()))
                .thenAnswer(
                        invocation ->
                                ((TransactionCallback<?>) invocation.getArgument(0))
                                        .doInTransaction(null));
        when(queueRepository.save(any(VerificationQueueEntry.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private VerificationQueueEntry entry(Long id, QueueSubjectType type, Long subjectId) {
        VerificationQueueEntry entry =
                VerificationQueueEntry.builder()
                        .id(id)
                        .subjectType(type)
                        .subjectId(subjectId)
                        .scheduledAt(LocalDateTime.now().minusMinutes(1))
                        .build();
        when(queueRepository.findById(id)).thenReturn(Optional.of(entry));
        return entry;
    }

    private void claimable(VerificationQueueEntry... entries) {
        when(queueRepository.findClaimable(any(), any(), any(Pageable.class)))
                .thenReturn(List.of(entries));
    }

    @Test
    void schedule_NewSubject_CreatesRowFiveToTenMinutesAhead() {
        when(queueRepository.findBySubjectTypeAndSubjectId(QueueSubjectType.BRAND, 7L))
                .thenReturn(Optional.empty());
        LocalDateTime before = LocalDateTime.now();

        VerificationQueueEntry entry = queueService.schedule(QueueSubjectType.BRAND, 7L);

        assertEquals(7L, entry.getSubjectId());
        assertFalse(entry.isProcessed());
        assertFalse(entry.getScheduledAt().isBefore(before.plusMinutes(5)));
        assertFalse(entry.getScheduledAt().isAfter(LocalDateTime.now().plusMinutes(10)));
    }

    @Test
    void schedule_ExistingRow_IsMovedAndReset() {
        VerificationQueueEntry existing =
                VerificationQueueEntry.builder()
                        .id(3L)
                        .subjectType(QueueSubjectType.INFLUENCER)
                        .subjectId(9L)
                        .processed(true)
                        .processedAt(LocalDateTime.now().minusDays(1))
                        .claimToken("stale")
                        .claimedAt(LocalDateTime.now().minusDays(1))
                        .build();
        when(queueRepository.findBySubjectTypeAndSubjectId(QueueSubjectType.INFLUENCER, 9L))
                .thenReturn(Optional.of(existing));

        VerificationQueueEntry entry = queueService.schedule(QueueSubjectType.INFLUENCER, 9L);

        assertSame(existing, entry);
        assertFalse(entry.isProcessed());
        assertNull(entry.getProcessedAt());
        assertNull(entry.getClaimToken());
        assertNull(entry.getClaimedAt());
    }

    @Test
    void drain_NothingDue_ReturnsEmptyStats() {
        claimable();

        assertEquals(DrainStats.empty(), queueService.drain());
        verify(queueRepository, never()).claim(anyLong(), anyString(), any(), any());
    }

    @Test
    void drain_OnlyProcessesEntriesItManagedToClaim() {
        VerificationQueueEntry e10 = entry(10L, QueueSubjectType.BRAND, 5L);
        VerificationQueueEntry e11 = entry(11L, QueueSubjectType.BRAND, 6L);
        claimable(e10, e11);
        when(queueRepository.claim(eq(10L), anyString(), any(), any())).thenReturn(1);
        when(queueRepository.claim(eq(11L), anyString(), any(), any())).thenReturn(0);

        Brand brand = Brand.builder().id(5L).build();
        when(brandRepository.findById(5L)).thenReturn(Optional.of(brand));
        doAnswer(
                        invocation -> {
                            brand.setVerificationStatus(BrandVerificationStatus.VERIFIED);
                            return null;
                        })
                .when(brandVerificationService)
                .verifyBrand(brand);

        DrainStats stats = queueService.drain();

        assertEquals(new DrainStats(1, 1, 0, 0, 0), stats);
        verify(queueRepository).complete(eq(10L), anyString(), any(), eq("approved"));
        verify(queueRepository, never()).complete(eq(11L), anyString(), any(), anyString());
        verify(brandRepository, never()).findById(6L);
        assertEquals(
                1.0,
                meterRegistry.get("verification.queue.items").tag("result", "approved").counter()
                        .count());
    }

    @Test
    void drain_CompletesWithTheTokenUsedToClaim() {
        VerificationQueueEntry e10 = entry(10L, QueueSubjectType.BRAND, 5L);
        claimable(e10);
        when(queueRepository.claim(eq(10L), anyString(), any(), any())).thenReturn(1);
        when(brandRepository.findById(5L)).thenReturn(Optional.of(Brand.builder().id(5L).build()));

        queueService.drain();

        ArgumentCaptor<String> claimToken = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> completeToken = ArgumentCaptor.forClass(String.class);
        verify(queueRepository).claim(eq(10L), claimToken.capture(), any(), any());
        verify(queueRepository)
                .complete(eq(10L), completeToken.capture(), any(), eq("pending"));
        assertEquals(claimToken.getValue(), completeToken.getValue());
    }

    @Test
    void drain_PausedAndApprovedSubjectsAreSkipped() {
        VerificationQueueEntry e20 = entry(20L, QueueSubjectType.INFLUENCER, 1L);
        VerificationQueueEntry e21 = entry(21L, QueueSubjectType.BRAND, 2L);
        claimable(e20, e21);
        when(queueRepository.claim(anyLong(), anyString(), any(), any())).thenReturn(1);
        when(influencerRepository.findById(1L))
                .thenReturn(
                        Optional.of(
                                Influencer.builder()
                                        .id(1L)
                                        .verificationStatus(InfluencerVerificationStatus.PAUSED)
                                        .build()));
        when(brandRepository.findById(2L))
                .thenReturn(
                        Optional.of(
                                Brand.builder()
                                        .id(2L)
                                        .verificationStatus(BrandVerificationStatus.VERIFIED)
                                        .build()));

        DrainStats stats = queueService.drain();

        assertEquals(new DrainStats(2, 0, 0, 2, 0), stats);
        verifyNoInteractions(connectionVerificationService, brandVerificationService);
        verify(queueRepository, times(2)).complete(anyLong(), anyString(), any(), eq("skipped"));
    }

    @Test
    void drain_PendingInfluencerIsVerifiedThenConsideredForApproval() {
        VerificationQueueEntry e30 = entry(30L, QueueSubjectType.INFLUENCER, 4L);
        claimable(e30);
        when(queueRepository.claim(anyLong(), anyString(), any(), any())).thenReturn(1);
        Influencer influencer = Influencer.builder().id(4L).build();
        when(influencerRepository.findById(4L)).thenReturn(Optional.of(influencer));
        when(connectionVerificationService.autoApproveInfluencer(influencer)).thenReturn(true);

        DrainStats stats = queueService.drain();

        assertEquals(new DrainStats(1, 1, 0, 0, 0), stats);
        verify(connectionVerificationService).verifyInfluencerPlatforms(influencer);
    }

    @Test
    void drain_MissingSubjectIsSkipped() {
        VerificationQueueEntry e40 = entry(40L, QueueSubjectType.BRAND, 99L);
        claimable(e40);
        when(queueRepository.claim(anyLong(), anyString(), any(), any())).thenReturn(1);
        when(brandRepository.findById(99L)).thenReturn(Optional.empty());

        assertEquals(new DrainStats(1, 0, 0, 1, 0), queueService.drain());
    }

    @Test
    void drain_FailureReleasesTheClaimAndContinues() {
        VerificationQueueEntry e50 = entry(50L, QueueSubjectType.BRAND, 5L);
        VerificationQueueEntry e51 = entry(51L, QueueSubjectType.BRAND, 6L);
        claimable(e50, e51);
        when(queueRepository.claim(anyLong(), anyString(), any(), any())).thenReturn(1);
        Brand failing = Brand.builder().id(5L).build();
        when(brandRepository.findById(5L)).thenReturn(Optional.of(failing));
        when(brandRepository.findById(6L)).thenReturn(Optional.of(Brand.builder().id(6L).build()));
        when(brandVerificationService.verifyBrand(failing))
                .thenThrow(new IllegalStateException("database hiccup"));

        DrainStats stats = queueService.drain();

        assertEquals(new DrainStats(1, 0, 1, 0, 1), stats);
        verify(queueRepository).release(eq(50L), anyString(), eq("error: IllegalStateException"));
        verify(queueRepository, never()).complete(eq(50L), anyString(), any(), anyString());
        verify(queueRepository).complete(eq(51L), anyString(), any(), eq("pending"));
    }

    @Test
    void backlogCountsUnprocessedRows() {
        when(queueRepository.countByProcessedFalse()).thenReturn(4L);

        assertEquals(4L, queueService.backlog());
    }
}
