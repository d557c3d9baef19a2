package com.ledgerimport.ingestion.job;

import com.ledgerimport.domain.BatchStagedEvent;
import com.ledgerimport.domain.ImportBatch;
import com.ledgerimport.domain.ImportBatchStatus;
import com.ledgerimport.ingestion.categorization.BatchCategorizationService;
import com.ledgerimport.ingestion.progress.ImportProgressTracker;
import com.ledgerimport.ingestion.store.StagingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CategorizationJobTest {

    @Mock
    StagingStore stagingStore;
    @Mock
    BatchCategorizationService batchCategorizationService;
    @Mock
    ImportProgressTracker progressTracker;

    @InjectMocks
    CategorizationJob job;

    private ImportBatch batch;

    @BeforeEach
    void setUp() {
        batch = new ImportBatch();
        batch.setId("b1");
        batch.setBatchNumber("IB-0000AAAA");
        batch.setStatus(ImportBatchStatus.REVIEWING);
        batch.setProgressPct(85);
    }

    @Test
    void onBatchStaged_categorizesAndMarksCompleted() {
        when(stagingStore.getBatch("b1")).thenReturn(batch);
        when(batchCategorizationService.categorizeBatch(batch)).thenReturn(12);

        job.onBatchStaged(new BatchStagedEvent("b1", "owner-1"));

        verify(stagingStore).markCategorizationCompleted("b1");
        verify(progressTracker).report("b1", "categorizing", 85, "Categorized 12 transactions");
    }

    @Test
    void run_rejectedBatchIsSkipped() {
        batch.setStatus(ImportBatchStatus.REJECTED);
        when(stagingStore.getBatch("b1")).thenReturn(batch);

        job.run("b1");

        verifyNoInteractions(batchCategorizationService, progressTracker);
        verify(stagingStore).markCategorizationCompleted("b1");
    }

    @Test
    void run_failureIsReportedNotThrown() {
        when(stagingStore.getBatch("b1")).thenReturn(batch);
        when(batchCategorizationService.categorizeBatch(any())).thenThrow(new IllegalStateException("mongo down"));

        job.run("b1");

        verify(progressTracker).reportError("b1", "categorizing", "Categorization failed: mongo down");
        verify(stagingStore, never()).markCategorizationCompleted("b1");
    }
}
