package com.prospectpulse.enrichment.service;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.FailureReasons;
import com.prospectpulse.enrichment.model.JobStatus;
import com.prospectpulse.enrichment.persistence.EnrichmentJdbcRepository;
import com.prospectpulse.enrichment.pipeline.ExecutionOutcome;
import com.prospectpulse.enrichment.pipeline.PipelineExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrichmentWorkerTest {
    private static final String JOB_ID = "job-7";
    private static final String OWNER = "worker-1";

    @Mock
    private PipelineExecutor executor;
    @Mock
    private EnrichmentJdbcRepository repository;

    private ProspectProperties properties;
    private EnrichmentWorker worker;

    @BeforeEach
    void setUp() {
        properties = new ProspectProperties();
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setBackoffMs(List.of(100L, 400L));
        properties.getRetry().setJitterMs(0);
        worker = new EnrichmentWorker(executor, repository, properties);
    }

    @Test
    void transientOutcomeSchedulesBackoff() {
        when(executor.execute(JOB_ID, OWNER))
            .thenReturn(ExecutionOutcome.retry(JobStatus.running(), FailureReasons.PROVIDER_TIMEOUT, Duration.ZERO));
        when(repository.incrementRetryCount(JOB_ID)).thenReturn(1);

        WorkerDisposition disposition = worker.process(JOB_ID, OWNER);

        assertEquals(WorkerDisposition.Kind.RETRY_AFTER, disposition.kind());
        assertEquals(Duration.ofMillis(100), disposition.delay());
        verify(executor, never()).exhaust(anyString(), anyString());
    }

    @Test
    void retryAfterHintWinsOverShorterBackoff() {
        when(executor.execute(JOB_ID, OWNER))
            .thenReturn(ExecutionOutcome.retry(JobStatus.running(), FailureReasons.RATE_LIMITED, Duration.ofSeconds(3)));
        when(repository.incrementRetryCount(JOB_ID)).thenReturn(2);

        WorkerDisposition disposition = worker.process(JOB_ID, OWNER);

        assertEquals(Duration.ofSeconds(3), disposition.delay());
    }

    @Test
    void lastBackoffStepRepeats() {
        properties.getRetry().setMaxAttempts(10);
        assertEquals(Duration.ofMillis(400), worker.backoff(2, Duration.ZERO));
        assertEquals(Duration.ofMillis(400), worker.backoff(7, null));
    }

    @Test
    void jitterStaysWithinConfiguredBound() {
        properties.getRetry().setJitterMs(50);
        Duration delay = worker.backoff(1, Duration.ZERO);
        assertTrue(delay.toMillis() >= 100 && delay.toMillis() <= 150, "delay=" + delay);
    }

    @Test
    void exhaustedRetriesFailTheJob() {
        when(executor.execute(JOB_ID, OWNER))
            .thenReturn(ExecutionOutcome.retry(JobStatus.running(), FailureReasons.PROVIDER_5XX, Duration.ZERO));
        when(repository.incrementRetryCount(JOB_ID)).thenReturn(3);
        when(executor.exhaust(JOB_ID, FailureReasons.RETRIES_EXHAUSTED))
            .thenReturn(ExecutionOutcome.failed(JobStatus.failed(FailureReasons.RETRIES_EXHAUSTED)));

        WorkerDisposition disposition = worker.process(JOB_ID, OWNER);

        assertTrue(disposition.isDone());
        verify(executor).exhaust(JOB_ID, FailureReasons.RETRIES_EXHAUSTED);
    }

    @Test
    void lostRaceIsDropped() {
        when(executor.execute(JOB_ID, OWNER))
            .thenThrow(new InvalidTransitionException(JOB_ID, JobStatus.succeeded(), JobStatus.running()));

        WorkerDisposition disposition = worker.process(JOB_ID, OWNER);

        assertTrue(disposition.isDone());
        verify(repository, never()).incrementRetryCount(anyString());
    }

    @Test
    void leaseHeldElsewhereDefersUntilLeaseExpires() {
        when(executor.execute(JOB_ID, OWNER))
            .thenThrow(new JobLeaseHeldException(JOB_ID, "worker-2", Instant.now().plusSeconds(60)));

        WorkerDisposition disposition = worker.process(JOB_ID, OWNER);

        assertEquals(WorkerDisposition.Kind.DEFERRED, disposition.kind());
        assertFalse(disposition.isDone());
        assertTrue(disposition.delay().toMillis() > 55_000 && disposition.delay().toMillis() <= 60_000, "delay=" + disposition.delay());
        verify(repository, never()).incrementRetryCount(anyString());
    }

    @Test
    void expiredOrUnknownLeaseDefersByAtLeastOnePollInterval() {
        properties.getWorker().setPollIntervalMs(250);

        assertEquals(Duration.ofMillis(250), worker.leaseRemaining(Instant.now().minusSeconds(5)));
        assertEquals(Duration.ofMillis(250), worker.leaseRemaining(null));
    }

    @Test
    void finishedOutcomesAreDone() {
        when(executor.execute(JOB_ID, OWNER)).thenReturn(ExecutionOutcome.succeeded(JobStatus.succeeded()));

        assertTrue(worker.process(JOB_ID, OWNER).isDone());
        verify(repository, never()).incrementRetryCount(anyString());
    }
}
