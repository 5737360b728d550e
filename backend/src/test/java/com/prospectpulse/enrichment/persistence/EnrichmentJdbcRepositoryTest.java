package com.prospectpulse.enrichment.persistence;

import com.prospectpulse.enrichment.model.FailureReasons;
import com.prospectpulse.enrichment.model.Job;
import com.prospectpulse.enrichment.model.JobHistoryEntry;
import com.prospectpulse.enrichment.model.JobState;
import com.prospectpulse.enrichment.model.JobStatus;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.PipelineStage;
import com.prospectpulse.enrichment.service.DuplicateActiveJobException;
import com.prospectpulse.enrichment.service.InvalidTransitionException;
import com.prospectpulse.enrichment.service.LeadNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class EnrichmentJdbcRepositoryTest {

    @Autowired
    private EnrichmentJdbcRepository repository;

    @Test
    void secondActiveJobForSameLeadIsRejected() {
        String leadId = newLead("ws-dup");
        String first = repository.createJob(leadId, "ws-dup");

        assertThatThrownBy(() -> repository.createJob(leadId, "ws-dup"))
            .isInstanceOf(DuplicateActiveJobException.class)
            .satisfies(ex -> assertEquals(first, ((DuplicateActiveJobException) ex).getActiveJobId()));

        repository.updateJobStatus(first, JobStatus.running());
        repository.updateJobStatus(first, JobStatus.failed(FailureReasons.PROVIDER_REJECTED));

        String second = repository.createJob(leadId, "ws-dup");
        assertNotEquals(first, second);
        assertEquals(second, repository.findActiveJobId(leadId, "ws-dup"));
    }

    @Test
    void stageResultsAreAppendOnly() {
        String leadId = newLead("ws-append");

        assertTrue(repository.upsertLeadResult(leadId, PipelineStage.MINING, Map.of("company", "First")));
        assertFalse(repository.upsertLeadResult(leadId, PipelineStage.MINING, Map.of("company", "Second")));

        Lead lead = repository.getLead(leadId);
        assertEquals("First", lead.mined().get("company"));
        assertNull(lead.validated());
    }

    @Test
    void resultForMissingLeadIsRejected() {
        assertThatThrownBy(() -> repository.upsertLeadResult("missing-" + UUID.randomUUID(), PipelineStage.MINING, Map.of()))
            .isInstanceOf(LeadNotFoundException.class);
    }

    @Test
    void gradeIsSetOnceAndOnlyAfterSynthesis() {
        String leadId = newLead("ws-grade");
        assertFalse(repository.setLeadGrade(leadId, "B"));

        repository.upsertLeadResult(leadId, PipelineStage.SYNTHESIS, Map.of("fit_score", 72));
        assertTrue(repository.setLeadGrade(leadId, "B"));
        assertFalse(repository.setLeadGrade(leadId, "A"));
        assertEquals("B", repository.getLead(leadId).grade());
    }

    @Test
    void historyFollowsHappyPathWithIncreasingTimestamps() {
        String leadId = newLead("ws-history");
        String jobId = repository.createJob(leadId, "ws-history");
        List<JobStatus> path = List.of(
            JobStatus.running(),
            JobStatus.stageComplete(PipelineStage.MINING),
            JobStatus.stageComplete(PipelineStage.VALIDATION),
            JobStatus.stageComplete(PipelineStage.SYNTHESIS),
            JobStatus.succeeded()
        );
        Instant previous = repository.getJob(jobId).updatedAt();
        for (JobStatus next : path) {
            Job updated = repository.updateJobStatus(jobId, next);
            assertTrue(updated.updatedAt().isAfter(previous), next + " did not advance updated_at");
            previous = updated.updatedAt();
        }

        List<JobHistoryEntry> history = repository.findJobHistory(jobId);
        assertEquals(6, history.size());
        assertEquals(JobStatus.queued(), history.get(0).status());
        for (int i = 1; i < history.size(); i++) {
            assertEquals(path.get(i - 1), history.get(i).status());
            assertTrue(history.get(i).recordedAt().isAfter(history.get(i - 1).recordedAt()));
        }
        assertNull(repository.findActiveJobId(leadId, "ws-history"));
    }

    @Test
    void illegalTransitionLeavesJobUntouched() {
        String leadId = newLead("ws-illegal");
        String jobId = repository.createJob(leadId, "ws-illegal");

        assertThatThrownBy(() -> repository.updateJobStatus(jobId, JobStatus.stageComplete(PipelineStage.MINING)))
            .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> repository.updateJobStatus(jobId, JobStatus.failed(FailureReasons.UNKNOWN)))
            .isInstanceOf(InvalidTransitionException.class);

        assertEquals(JobState.QUEUED, repository.getJob(jobId).status().state());
        assertEquals(1, repository.findJobHistory(jobId).size());
    }

    @Test
    void leaseExcludesOtherOwnersUntilReleased() {
        String leadId = newLead("ws-lease");
        String jobId = repository.createJob(leadId, "ws-lease");

        Job claimed = repository.claimJob(jobId, "owner-a", Duration.ofMinutes(5));
        assertEquals("owner-a", claimed.leaseOwner());
        assertThatThrownBy(() -> repository.claimJob(jobId, "owner-b", Duration.ofMinutes(5)))
            .isInstanceOf(InvalidTransitionException.class);

        repository.releaseJob(jobId, "owner-a");
        assertEquals("owner-b", repository.claimJob(jobId, "owner-b", Duration.ofMinutes(5)).leaseOwner());
    }

    @Test
    void retryCountIncrements() {
        String leadId = newLead("ws-retry");
        String jobId = repository.createJob(leadId, "ws-retry");
        assertEquals(1, repository.incrementRetryCount(jobId));
        assertEquals(2, repository.incrementRetryCount(jobId));
        assertEquals(2, repository.getJob(jobId).retryCount());
    }

    @Test
    void nextTimestampIsStrictlyAfterPrevious() {
        Instant future = Instant.now().plusSeconds(60);
        Instant next = EnrichmentJdbcRepository.nextTimestamp(future);
        assertTrue(next.isAfter(future));
        assertTrue(EnrichmentJdbcRepository.nextTimestamp(null).isBefore(Instant.now().plusSeconds(1)));
    }

    @Test
    void concurrentSubmissionsCreateOneActiveJob() throws Exception {
        String leadId = newLead("ws-race-create");

        List<Object> results = runConcurrently(8, () -> {
            try {
                return repository.createJob(leadId, "ws-race-create");
            } catch (DuplicateActiveJobException e) {
                return e;
            }
        });

        List<String> created = new ArrayList<>();
        int rejected = 0;
        for (Object result : results) {
            if (result instanceof String) {
                created.add((String) result);
            } else {
                rejected++;
                assertTrue(result instanceof DuplicateActiveJobException, "unexpected " + result);
            }
        }
        assertEquals(1, created.size());
        assertEquals(7, rejected);
        assertEquals(created.get(0), repository.findActiveJobId(leadId, "ws-race-create"));
    }

    @Test
    void concurrentTransitionsHaveOneWinner() throws Exception {
        String leadId = newLead("ws-race-cas");
        String jobId = repository.createJob(leadId, "ws-race-cas");

        List<Object> results = runConcurrently(8, () -> {
            try {
                return repository.updateJobStatus(jobId, JobStatus.running());
            } catch (InvalidTransitionException e) {
                return e;
            }
        });

        long winners = results.stream().filter(Job.class::isInstance).count();
        long losers = results.stream().filter(InvalidTransitionException.class::isInstance).count();
        assertEquals(1, winners);
        assertEquals(7, losers);
        assertEquals(JobStatus.running(), repository.getJob(jobId).status());
        assertEquals(2, repository.findJobHistory(jobId).size());
    }

    private static List<Object> runConcurrently(int threads, Callable<Object> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<Object> results = new ArrayList<>();
            for (Future<Object> future : futures) {
                try {
                    results.add(future.get(10, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    throw new AssertionError("concurrent call failed", e.getCause());
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private String newLead(String workspaceId) {
        String leadId = "lead-" + UUID.randomUUID();
        repository.upsertLead(leadId, workspaceId, Map.of("company", "Co " + leadId));
        return leadId;
    }
}
