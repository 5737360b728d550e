package com.prospectpulse.enrichment.service;

import com.prospectpulse.enrichment.model.DeliveryMode;
import com.prospectpulse.enrichment.model.HealthResponse;
import com.prospectpulse.enrichment.model.JobHistoryEntry;
import com.prospectpulse.enrichment.model.JobStatus;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.PipelineStage;
import com.prospectpulse.enrichment.model.SubmissionResult;
import com.prospectpulse.enrichment.persistence.EnrichmentJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "prospect.queue.enabled=false")
@ActiveProfiles("test")
class InlineDeliveryTest {

    @Autowired
    private LeadJobService leadJobService;

    @Autowired
    private WorkerDaemonService daemonService;

    @Autowired
    private StaleJobRecoveryRunner recoveryRunner;

    @Autowired
    private EnrichmentJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void inlineDeliveryFinishesBeforeSubmitReturns() {
        SubmissionResult submitted = leadJobService.submit(
            Map.of("company", "Acme", "contact", "jdoe@acme.com"),
            "ws-" + UUID.randomUUID(),
            false
        );

        assertThat(submitted.delivery()).isEqualTo(DeliveryMode.INLINE);
        assertThat(leadJobService.getStatus(submitted.jobId()).status()).isEqualTo(JobStatus.succeeded());
        Lead lead = leadJobService.getLead(submitted.leadId());
        assertThat(lead.synthesized()).containsEntry("fit_score", 85);
        assertThat(lead.grade()).isEqualTo("A");
        assertThat(leadJobService.getHistory(submitted.jobId()))
            .extracting(JobHistoryEntry::status)
            .containsExactly(
                JobStatus.queued(),
                JobStatus.running(),
                JobStatus.stageComplete(PipelineStage.MINING),
                JobStatus.stageComplete(PipelineStage.VALIDATION),
                JobStatus.stageComplete(PipelineStage.SYNTHESIS),
                JobStatus.succeeded()
            );
    }

    @Test
    void workersStayIdleWithoutQueue() {
        daemonService.start();
        assertThat(daemonService.isRunning()).isFalse();
        assertThat(daemonService.getStatus().queueEnabled()).isFalse();

        HealthResponse health = leadJobService.health();
        assertThat(health.status()).isEqualTo("ok");
        assertThat(health.queueEnabled()).isFalse();
    }

    @Test
    void staleJobIsRecoveredOnStartupPass() {
        String workspace = "ws-" + UUID.randomUUID();
        String leadId = "lead-" + UUID.randomUUID();
        repository.upsertLead(leadId, workspace, Map.of("company", "Stale Co"));
        String jobId = repository.createJob(leadId, workspace);
        jdbc.update(
            "UPDATE jobs SET updated_at = :old WHERE job_id = :jobId",
            new MapSqlParameterSource()
                .addValue("old", Timestamp.from(Instant.now().minus(Duration.ofHours(2))))
                .addValue("jobId", jobId)
        );

        int recovered = recoveryRunner.recover();

        assertThat(recovered).isGreaterThanOrEqualTo(1);
        assertThat(repository.getJob(jobId).status()).isEqualTo(JobStatus.succeeded());
    }
}
