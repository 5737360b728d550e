package com.prospectpulse.enrichment.service;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.FailureReasons;
import com.prospectpulse.enrichment.persistence.EnrichmentJdbcRepository;
import com.prospectpulse.enrichment.pipeline.ExecutionOutcome;
import com.prospectpulse.enrichment.pipeline.PipelineExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class EnrichmentWorker {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentWorker.class);

    private final PipelineExecutor executor;
    private final EnrichmentJdbcRepository repository;
    private final ProspectProperties properties;

    public EnrichmentWorker(PipelineExecutor executor, EnrichmentJdbcRepository repository, ProspectProperties properties) {
        this.executor = executor;
        this.repository = repository;
        this.properties = properties;
    }

    public WorkerDisposition process(String jobId, String owner) {
        ExecutionOutcome outcome;
        try {
            outcome = executor.execute(jobId, owner);
        } catch (JobLeaseHeldException e) {
            Duration delay = leaseRemaining(e.getLeaseUntil());
            log.warn("Deferring delivery of job {} for {} by {}ms: {}", jobId, owner, delay.toMillis(), e.getMessage());
            return WorkerDisposition.deferred(delay);
        } catch (InvalidTransitionException e) {
            log.warn("Dropping delivery of job {} for {}: {}", jobId, owner, e.getMessage());
            return WorkerDisposition.done();
        } catch (JobNotFoundException e) {
            log.warn("Dropping delivery of unknown job {}", jobId);
            return WorkerDisposition.done();
        }

        if (outcome.kind() != ExecutionOutcome.Kind.RETRY) {
            return WorkerDisposition.done();
        }

        int attempts = repository.incrementRetryCount(jobId);
        if (attempts >= properties.getRetry().getMaxAttempts()) {
            log.warn("Job {} exhausted {} attempts, last reason={}", jobId, attempts, outcome.reason());
            try {
                executor.exhaust(jobId, FailureReasons.RETRIES_EXHAUSTED);
            } catch (InvalidTransitionException e) {
                log.warn("Job {} changed state before it could be marked exhausted: {}", jobId, e.getMessage());
            }
            return WorkerDisposition.done();
        }
        Duration delay = backoff(attempts, outcome.retryAfter());
        log.info("Job {} retry {} scheduled in {}ms (reason={})", jobId, attempts, delay.toMillis(), outcome.reason());
        return WorkerDisposition.retryAfter(delay);
    }

    Duration leaseRemaining(Instant leaseUntil) {
        Duration floor = Duration.ofMillis(properties.getWorker().getPollIntervalMs());
        if (leaseUntil == null) {
            return Duration.ofMillis(Math.max(floor.toMillis(), properties.getRetry().getBackoffMs().get(0)));
        }
        Duration remaining = Duration.between(Instant.now(), leaseUntil);
        return remaining.compareTo(floor) > 0 ? remaining : floor;
    }

    Duration backoff(int attempts, Duration retryAfter) {
        List<Long> steps = properties.getRetry().getBackoffMs();
        int index = Math.min(Math.max(0, attempts - 1), steps.size() - 1);
        long jitterMs = properties.getRetry().getJitterMs();
        long jitter = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0L;
        Duration delay = Duration.ofMillis(Math.max(0L, steps.get(index)) + jitter);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            return retryAfter;
        }
        return delay;
    }
}
