package com.ledgerimport.ingestion.job;

import com.ledgerimport.domain.BatchStagedEvent;
import com.ledgerimport.domain.ImportBatch;
import com.ledgerimport.domain.ImportBatchRepository;
import com.ledgerimport.domain.ImportBatchStatus;
import com.ledgerimport.ingestion.config.CategorizationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CategorizationRecoveryJobTest {

    @Mock
    ImportBatchRepository importBatchRepository;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    private CategorizationRecoveryJob job;

    @BeforeEach
    void setUp() {
        CategorizationProperties properties = new CategorizationProperties();
        properties.setStaleAfterMinutes(15);
        properties.setMaxAttempts(3);
        job = new CategorizationRecoveryJob(importBatchRepository, properties, applicationEventPublisher);
    }

    @Test
    @DisplayName("stale dispatched batches are marked again and re-published")
    void redispatchStale() {
        ImportBatch stale = new ImportBatch();
        stale.setId("b1");
        stale.setOwnerId("owner-1");
        stale.setCategorizationAttempts(1);
        when(importBatchRepository
                .findByCategorizationEnabledTrueAndCategorizationCompletedAtIsNullAndCategorizationAbandonedAtIsNullAndCategorizationDispatchedAtBeforeAndStatusNotIn(
                        any(Instant.class), anyCollection()))
                .thenReturn(List.of(stale));

        Instant before = Instant.now();
        assertThat(job.redispatchStale()).isEqualTo(1);

        verify(importBatchRepository).markCategorizationDispatched("b1");
        verify(applicationEventPublisher).publishEvent(new BatchStagedEvent("b1", "owner-1"));

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<ImportBatchStatus>> excluded = ArgumentCaptor.forClass(Collection.class);
        verify(importBatchRepository)
                .findByCategorizationEnabledTrueAndCategorizationCompletedAtIsNullAndCategorizationAbandonedAtIsNullAndCategorizationDispatchedAtBeforeAndStatusNotIn(
                        cutoff.capture(), excluded.capture());
        assertThat(cutoff.getValue()).isBeforeOrEqualTo(before.minus(Duration.ofMinutes(15)).plusSeconds(1));
        assertThat(excluded.getValue()).containsExactlyInAnyOrder(ImportBatchStatus.REJECTED, ImportBatchStatus.COMPLETED);
    }

    @Test
    @DisplayName("a batch that used up its attempts is abandoned instead of re-dispatched")
    void redispatchStale_givesUpAfterMaxAttempts() {
        ImportBatch exhausted = new ImportBatch();
        exhausted.setId("b1");
        exhausted.setOwnerId("owner-1");
        exhausted.setCategorizationAttempts(3);
        ImportBatch retryable = new ImportBatch();
        retryable.setId("b2");
        retryable.setOwnerId("owner-1");
        retryable.setCategorizationAttempts(2);
        when(importBatchRepository
                .findByCategorizationEnabledTrueAndCategorizationCompletedAtIsNullAndCategorizationAbandonedAtIsNullAndCategorizationDispatchedAtBeforeAndStatusNotIn(
                        any(Instant.class), anyCollection()))
                .thenReturn(List.of(exhausted, retryable));

        assertThat(job.redispatchStale()).isEqualTo(1);

        verify(importBatchRepository).markCategorizationAbandoned(eq("b1"), contains("3 attempts"));
        verify(importBatchRepository, never()).markCategorizationDispatched("b1");
        verify(applicationEventPublisher, never()).publishEvent(new BatchStagedEvent("b1", "owner-1"));
        verify(importBatchRepository).markCategorizationDispatched("b2");
        verify(applicationEventPublisher).publishEvent(new BatchStagedEvent("b2", "owner-1"));
    }

    @Test
    void redispatchStale_nothingStale() {
        when(importBatchRepository
                .findByCategorizationEnabledTrueAndCategorizationCompletedAtIsNullAndCategorizationAbandonedAtIsNullAndCategorizationDispatchedAtBeforeAndStatusNotIn(
                        any(Instant.class), anyCollection()))
                .thenReturn(List.of());

        assertThat(job.redispatchStale()).isZero();
        verifyNoInteractions(applicationEventPublisher);
    }
}
