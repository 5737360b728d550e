package com.prospectpulse.enrichment.service;

import com.prospectpulse.enrichment.QueueDrainSupport;
import com.prospectpulse.enrichment.model.Job;
import com.prospectpulse.enrichment.model.JobHistoryEntry;
import com.prospectpulse.enrichment.model.JobStatus;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.PipelineStage;
import com.prospectpulse.enrichment.model.SubmissionResult;
import com.prospectpulse.enrichment.persistence.EnrichmentJdbcRepository;
import com.prospectpulse.enrichment.ratelimit.ProviderRateLimiter;
import com.prospectpulse.enrichment.ratelimit.RateLimitDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class RateLimitedMiningTest {

    @MockBean
    private ProviderRateLimiter rateLimiter;

    @Autowired
    private LeadJobService leadJobService;

    @Autowired
    private WorkerDaemonService daemonService;

    @Autowired
    private EnrichmentJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void clearQueue() {
        jdbc.update("DELETE FROM job_queue", Map.of());
    }

    @Test
    void miningDeniedTwiceIsRetriedAndWrittenOnce() throws Exception {
        AtomicInteger searchCalls = new AtomicInteger();
        when(rateLimiter.acquire(anyString())).thenAnswer(invocation -> {
            String provider = invocation.getArgument(0);
            if ("search".equals(provider) && searchCalls.incrementAndGet() <= 2) {
                return RateLimitDecision.wouldBlock(provider, Duration.ofMillis(15));
            }
            return RateLimitDecision.granted(provider);
        });

        SubmissionResult submitted = leadJobService.submit(
            Map.of("company", "Acme " + UUID.randomUUID(), "contact", "jdoe@acme.com"),
            "ws-" + UUID.randomUUID(),
            false
        );
        Job finished = QueueDrainSupport.drainUntilTerminal(daemonService, repository, submitted.jobId());

        assertThat(finished.status()).isEqualTo(JobStatus.succeeded());
        assertThat(finished.retryCount()).isEqualTo(2);
        assertThat(searchCalls.get()).isEqualTo(3);
        Lead lead = repository.getLead(submitted.leadId());
        assertThat(lead.mined()).isNotNull();
        List<JobStatus> history = repository.findJobHistory(submitted.jobId()).stream()
            .map(JobHistoryEntry::status)
            .toList();
        assertThat(history).containsOnlyOnce(JobStatus.stageComplete(PipelineStage.MINING));
        assertThat(history).containsOnlyOnce(JobStatus.running());
    }

    @Test
    void persistentRateLimitExhaustsRetries() throws Exception {
        when(rateLimiter.acquire(anyString()))
            .thenAnswer(invocation -> RateLimitDecision.wouldBlock(invocation.getArgument(0), Duration.ofMillis(5)));

        SubmissionResult submitted = leadJobService.submit(
            Map.of("company", "Blocked " + UUID.randomUUID()),
            "ws-" + UUID.randomUUID(),
            false
        );
        Job finished = QueueDrainSupport.drainUntilTerminal(daemonService, repository, submitted.jobId());

        assertThat(finished.status()).isEqualTo(JobStatus.failed("retries_exhausted"));
        assertThat(repository.getLead(submitted.leadId()).mined()).isNull();
    }
}
