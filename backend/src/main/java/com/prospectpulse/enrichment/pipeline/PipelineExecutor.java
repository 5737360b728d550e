package com.prospectpulse.enrichment.pipeline;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.FailureReasons;
import com.prospectpulse.enrichment.model.Job;
import com.prospectpulse.enrichment.model.JobState;
import com.prospectpulse.enrichment.model.JobStatus;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.PipelineStage;
import com.prospectpulse.enrichment.persistence.EnrichmentJdbcRepository;
import com.prospectpulse.enrichment.ratelimit.ProviderRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one job through mining, validation and synthesis. Stages whose result is already stored on the lead are
 * skipped, so a retried job resumes after the last completed stage.
 */
@Service
public class PipelineExecutor {
    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final EnrichmentJdbcRepository repository;
    private final ProviderRateLimiter rateLimiter;
    private final ProspectProperties properties;
    private final Map<PipelineStage, StageRunner> runners = new EnumMap<>(PipelineStage.class);

    public PipelineExecutor(
        EnrichmentJdbcRepository repository,
        ProviderRateLimiter rateLimiter,
        ProspectProperties properties,
        List<StageRunner> stageRunners
    ) {
        this.repository = repository;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        for (StageRunner runner : stageRunners) {
            if (runners.put(runner.stage(), runner) != null) {
                throw new IllegalStateException("Duplicate stage runner for " + runner.stage().key());
            }
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (!runners.containsKey(stage)) {
                throw new IllegalStateException("Missing stage runner for " + stage.key());
            }
        }
    }

    /**
     * Claims the job lease for {@code owner} and runs the remaining stages. Throws
     * {@link com.prospectpulse.enrichment.service.InvalidTransitionException} when another owner holds the job.
     */
    public ExecutionOutcome execute(String jobId, String owner) {
        Job job = repository.getJob(jobId);
        if (job.isTerminal()) {
            log.debug("Job {} already terminal as {}, nothing to run", jobId, job.status());
            return ExecutionOutcome.skipped(job.status());
        }
        Job claimed = repository.claimJob(jobId, owner, Duration.ofSeconds(properties.getWorker().getLeaseTtlSeconds()));
        try {
            return runClaimed(claimed);
        } finally {
            try {
                repository.releaseJob(jobId, owner);
            } catch (RuntimeException e) {
                log.warn("Failed to release lease on job {} held by {}", jobId, owner, e);
            }
        }
    }

    private ExecutionOutcome runClaimed(Job job) {
        Job current = job;
        if (current.status().state() == JobState.QUEUED) {
            current = repository.updateJobStatus(current.id(), JobStatus.running());
        }

        Optional<Lead> maybeLead = repository.findLead(current.leadId());
        if (maybeLead.isEmpty()) {
            return fail(current, FailureReasons.LEAD_NOT_FOUND);
        }
        Lead lead = maybeLead.get();

        for (PipelineStage stage : PipelineStage.values()) {
            if (!lead.hasResult(stage)) {
                StageOutcome outcome = invoke(stage, lead, current);
                if (outcome.kind() == StageOutcome.Kind.TRANSIENT_FAILURE) {
                    log.info(
                        "Job {} stage {} deferred: reason={} retryAfter={}ms",
                        current.id(),
                        stage.key(),
                        outcome.reason(),
                        outcome.retryAfter().toMillis()
                    );
                    return ExecutionOutcome.retry(current.status(), outcome.reason(), outcome.retryAfter());
                }
                if (outcome.kind() == StageOutcome.Kind.PERMANENT_FAILURE) {
                    return fail(current, outcome.reason());
                }
                if (!repository.upsertLeadResult(lead.id(), stage, outcome.payload())) {
                    log.info("Lead {} already had a {} result, keeping the first write", lead.id(), stage.key());
                }
                lead = repository.getLead(lead.id());
            } else {
                log.debug("Job {} skipping {}: result already stored on lead {}", current.id(), stage.key(), lead.id());
            }
            if (!current.status().hasCompleted(stage)) {
                current = repository.updateJobStatus(current.id(), JobStatus.stageComplete(stage));
            }
        }

        if (lead.grade() == null) {
            repository.setLeadGrade(lead.id(), LeadGrader.grade(lead.synthesized()));
        }
        current = repository.updateJobStatus(current.id(), JobStatus.succeeded());
        log.info("Job {} succeeded for lead {}", current.id(), lead.id());
        return ExecutionOutcome.succeeded(current.status());
    }

    private StageOutcome invoke(PipelineStage stage, Lead lead, Job job) {
        try {
            return runners.get(stage).run(lead, rateLimiter);
        } catch (ProviderCallException e) {
            StageOutcome outcome = ProviderFailureClassifier.classify(e);
            log.warn(
                "Job {} stage {} provider {} failed: status={} reason={}",
                job.id(),
                stage.key(),
                e.getProvider(),
                e.getHttpStatus(),
                outcome.reason()
            );
            return outcome;
        } catch (RuntimeException e) {
            log.warn("Job {} stage {} threw unexpectedly", job.id(), stage.key(), e);
            return StageOutcome.transientFailure(FailureReasons.STAGE_EXCEPTION, Duration.ZERO);
        }
    }

    private ExecutionOutcome fail(Job job, String reason) {
        Job failed = repository.updateJobStatus(job.id(), JobStatus.failed(reason));
        log.info("Job {} failed permanently: reason={}", job.id(), reason);
        return ExecutionOutcome.failed(failed.status());
    }

    /**
     * Marks an active job failed without running it, used when the retry budget is spent.
     */
    public ExecutionOutcome exhaust(String jobId, String reason) {
        Job job = repository.getJob(jobId);
        if (job.isTerminal()) {
            return ExecutionOutcome.skipped(job.status());
        }
        if (job.status().state() == JobState.QUEUED) {
            job = repository.updateJobStatus(jobId, JobStatus.running());
        }
        return fail(job, reason);
    }
}
