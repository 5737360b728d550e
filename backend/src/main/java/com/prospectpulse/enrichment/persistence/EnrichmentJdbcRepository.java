package com.prospectpulse.enrichment.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospectpulse.enrichment.model.Job;
import com.prospectpulse.enrichment.model.JobHistoryEntry;
import com.prospectpulse.enrichment.model.JobState;
import com.prospectpulse.enrichment.model.JobStatus;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.PipelineStage;
import com.prospectpulse.enrichment.service.DuplicateActiveJobException;
import com.prospectpulse.enrichment.service.InvalidTransitionException;
import com.prospectpulse.enrichment.service.JobLeaseHeldException;
import com.prospectpulse.enrichment.service.JobNotFoundException;
import com.prospectpulse.enrichment.service.LeadNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
public class EnrichmentJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentJdbcRepository.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final int MAX_CAS_ATTEMPTS = 8;

    private static final String JOB_COLUMNS = """
        job_id, lead_id, workspace_id, status, stage, failure_reason,
        retry_count, version, lease_owner, lease_until, created_at, updated_at
        """;

    private static final String LEAD_COLUMNS = """
        lead_id, workspace_id, raw_input, mined_json, validated_json, synthesized_json,
        grade, created_at, updated_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<Job> jobRowMapper = (rs, rowNum) -> new Job(
        rs.getString("job_id"),
        rs.getString("lead_id"),
        rs.getString("workspace_id"),
        new JobStatus(
            JobState.fromKey(rs.getString("status")),
            PipelineStage.fromKey(rs.getString("stage")),
            rs.getString("failure_reason")
        ),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        rs.getInt("retry_count"),
        rs.getLong("version"),
        rs.getString("lease_owner"),
        toInstant(rs.getTimestamp("lease_until"))
    );
    private final RowMapper<Lead> leadRowMapper;

    public EnrichmentJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.leadRowMapper = (rs, rowNum) -> new Lead(
            rs.getString("lead_id"),
            rs.getString("workspace_id"),
            readStringMap(rs.getString("raw_input")),
            readJson(rs.getString("mined_json")),
            readJson(rs.getString("validated_json")),
            readJson(rs.getString("synthesized_json")),
            rs.getString("grade"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public boolean upsertLead(String leadId, String workspaceId, Map<String, String> rawInput) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leadId", leadId)
            .addValue("workspaceId", workspaceId)
            .addValue("rawInput", writeJson(rawInput))
            .addValue("now", Timestamp.from(now));
        try {
            jdbc.update(
                """
                    INSERT INTO leads (lead_id, workspace_id, raw_input, created_at, updated_at)
                    VALUES (:leadId, :workspaceId, :rawInput, :now, :now)
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException ignored) {
            return false;
        }
    }

    public Optional<Lead> findLead(String leadId) {
        List<Lead> leads = jdbc.query(
            "SELECT " + LEAD_COLUMNS + " FROM leads WHERE lead_id = :leadId",
            new MapSqlParameterSource().addValue("leadId", leadId),
            leadRowMapper
        );
        return leads.isEmpty() ? Optional.empty() : Optional.of(leads.get(0));
    }

    public Lead getLead(String leadId) {
        return findLead(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));
    }

    public List<Lead> findLeadsByWorkspace(String workspaceId, int limit, long offset) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("workspaceId", workspaceId)
            .addValue("limit", Math.max(1, limit))
            .addValue("offset", Math.max(0L, offset));
        return jdbc.query(
            "SELECT " + LEAD_COLUMNS + """
                FROM leads
                WHERE workspace_id = :workspaceId
                ORDER BY created_at DESC, lead_id
                LIMIT :limit OFFSET :offset
                """,
            params,
            leadRowMapper
        );
    }

    public long countLeadsByWorkspace(String workspaceId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM leads WHERE workspace_id = :workspaceId",
            new MapSqlParameterSource().addValue("workspaceId", workspaceId),
            Long.class
        );
        return count == null ? 0L : count;
    }

    /**
     * Writes a stage result only when the column is still empty. Returns {@code false} when an earlier write won.
     */
    public boolean upsertLeadResult(String leadId, PipelineStage stage, Map<String, Object> result) {
        if (result == null) {
            throw new IllegalArgumentException("result must not be null");
        }
        String column = resultColumn(stage);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leadId", leadId)
            .addValue("payload", writeJson(result))
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            "UPDATE leads SET " + column + " = :payload, updated_at = :now "
                + "WHERE lead_id = :leadId AND " + column + " IS NULL",
            params
        );
        if (updated == 0 && findLead(leadId).isEmpty()) {
            throw new LeadNotFoundException(leadId);
        }
        return updated == 1;
    }

    public boolean setLeadGrade(String leadId, String grade) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leadId", leadId)
            .addValue("grade", grade)
            .addValue("now", Timestamp.from(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE leads
                SET grade = :grade,
                    updated_at = :now
                WHERE lead_id = :leadId
                  AND grade IS NULL
                  AND synthesized_json IS NOT NULL
                """,
            params
        );
        return updated == 1;
    }

    public void resetLeadResults(String leadId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leadId", leadId)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE leads
                SET mined_json = NULL,
                    validated_json = NULL,
                    synthesized_json = NULL,
                    grade = NULL,
                    updated_at = :now
                WHERE lead_id = :leadId
                """,
            params
        );
    }

    public String createJob(String leadId, String workspaceId) {
        String jobId = UUID.randomUUID().toString();
        Instant now = nextTimestamp(null);
        JobStatus status = JobStatus.queued();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("leadId", leadId)
            .addValue("workspaceId", workspaceId)
            .addValue("status", status.state().key())
            .addValue("activeKey", activeKey(workspaceId, leadId))
            .addValue("now", Timestamp.from(now));
        try {
            jdbc.update(
                """
                    INSERT INTO jobs (
                        job_id, lead_id, workspace_id, status, active_key,
                        retry_count, version, created_at, updated_at
                    )
                    VALUES (:jobId, :leadId, :workspaceId, :status, :activeKey, 0, 0, :now, :now)
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateActiveJobException(leadId, workspaceId, findActiveJobId(leadId, workspaceId));
        }
        insertHistory(jobId, status, now);
        return jobId;
    }

    public String findActiveJobId(String leadId, String workspaceId) {
        List<String> ids = jdbc.query(
            "SELECT job_id FROM jobs WHERE active_key = :activeKey",
            new MapSqlParameterSource().addValue("activeKey", activeKey(workspaceId, leadId)),
            (rs, rowNum) -> rs.getString("job_id")
        );
        return ids.isEmpty() ? null : ids.get(0);
    }

    public Optional<Job> findJob(String jobId) {
        List<Job> jobs = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM jobs WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId),
            jobRowMapper
        );
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    public Job getJob(String jobId) {
        return findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Compare-and-set on the row version. The legality check is re-run against fresh state after a lost race.
     */
    public Job updateJobStatus(String jobId, JobStatus next) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Job current = getJob(jobId);
            if (!current.status().canTransitionTo(next)) {
                throw new InvalidTransitionException(jobId, current.status(), next);
            }
            Instant updatedAt = nextTimestamp(current.updatedAt());
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("version", current.version())
                .addValue("status", next.state().key())
                .addValue("stage", next.stage() == null ? null : next.stage().key())
                .addValue("failureReason", next.reason())
                .addValue("updatedAt", Timestamp.from(updatedAt));
            String releaseActiveKey = next.isTerminal() ? "active_key = NULL, " : "";
            int updated = jdbc.update(
                "UPDATE jobs SET status = :status, stage = :stage, failure_reason = :failureReason, "
                    + releaseActiveKey
                    + "version = version + 1, updated_at = :updatedAt "
                    + "WHERE job_id = :jobId AND version = :version",
                params
            );
            if (updated == 1) {
                insertHistory(jobId, next, updatedAt);
                return new Job(
                    current.id(),
                    current.leadId(),
                    current.workspaceId(),
                    next,
                    current.createdAt(),
                    updatedAt,
                    current.retryCount(),
                    current.version() + 1,
                    current.leaseOwner(),
                    current.leaseUntil()
                );
            }
            log.debug("Lost version race updating job {} to {} (attempt {})", jobId, next, attempt);
        }
        throw new InvalidTransitionException(jobId, "status update lost " + MAX_CAS_ATTEMPTS + " consecutive races");
    }

    public Job claimJob(String jobId, String owner, Duration leaseTtl) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Job current = getJob(jobId);
            if (current.isTerminal()) {
                throw new InvalidTransitionException(jobId, "already terminal: " + current.status());
            }
            Instant now = Instant.now();
            if (current.isLeasedAt(now) && !owner.equals(current.leaseOwner())) {
                throw new JobLeaseHeldException(jobId, current.leaseOwner(), current.leaseUntil());
            }
            Instant updatedAt = nextTimestamp(current.updatedAt());
            Instant leaseUntil = now.plus(leaseTtl);
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("version", current.version())
                .addValue("owner", owner)
                .addValue("leaseUntil", Timestamp.from(leaseUntil))
                .addValue("updatedAt", Timestamp.from(updatedAt));
            int updated = jdbc.update(
                """
                    UPDATE jobs
                    SET lease_owner = :owner,
                        lease_until = :leaseUntil,
                        version = version + 1,
                        updated_at = :updatedAt
                    WHERE job_id = :jobId
                      AND version = :version
                    """,
                params
            );
            if (updated == 1) {
                return new Job(
                    current.id(),
                    current.leadId(),
                    current.workspaceId(),
                    current.status(),
                    current.createdAt(),
                    updatedAt,
                    current.retryCount(),
                    current.version() + 1,
                    owner,
                    leaseUntil
                );
            }
        }
        throw new JobLeaseHeldException(jobId, null, null);
    }

    public void releaseJob(String jobId, String owner) {
        jdbc.update(
            """
                UPDATE jobs
                SET lease_owner = NULL,
                    lease_until = NULL
                WHERE job_id = :jobId
                  AND lease_owner = :owner
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("owner", owner)
        );
    }

    public int incrementRetryCount(String jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
        int updated = jdbc.update("UPDATE jobs SET retry_count = retry_count + 1 WHERE job_id = :jobId", params);
        if (updated == 0) {
            throw new JobNotFoundException(jobId);
        }
        Integer count = jdbc.queryForObject("SELECT retry_count FROM jobs WHERE job_id = :jobId", params, Integer.class);
        return count == null ? 0 : count;
    }

    public List<JobHistoryEntry> findJobHistory(String jobId) {
        return jdbc.query(
            """
                SELECT job_id, status, stage, failure_reason, recorded_at
                FROM job_status_history
                WHERE job_id = :jobId
                ORDER BY recorded_at, id
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            (rs, rowNum) -> new JobHistoryEntry(
                rs.getString("job_id"),
                new JobStatus(
                    JobState.fromKey(rs.getString("status")),
                    PipelineStage.fromKey(rs.getString("stage")),
                    rs.getString("failure_reason")
                ),
                toInstant(rs.getTimestamp("recorded_at"))
            )
        );
    }

    public List<Job> findStaleActiveJobs(Instant cutoff, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("now", Timestamp.from(Instant.now()))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM jobs
                WHERE status NOT IN ('succeeded', 'failed')
                  AND updated_at < :cutoff
                  AND (lease_until IS NULL OR lease_until < :now)
                ORDER BY updated_at
                LIMIT :limit
                """,
            params,
            jobRowMapper
        );
    }

    private void insertHistory(String jobId, JobStatus status, Instant recordedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", status.state().key())
            .addValue("stage", status.stage() == null ? null : status.stage().key())
            .addValue("failureReason", status.reason())
            .addValue("recordedAt", Timestamp.from(recordedAt));
        jdbc.update(
            """
                INSERT INTO job_status_history (job_id, status, stage, failure_reason, recorded_at)
                VALUES (:jobId, :status, :stage, :failureReason, :recordedAt)
                """,
            params
        );
    }

    static Instant nextTimestamp(Instant previous) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        if (previous != null && !now.isAfter(previous)) {
            return previous.truncatedTo(ChronoUnit.MICROS).plus(1, ChronoUnit.MICROS);
        }
        return now;
    }

    private static String activeKey(String workspaceId, String leadId) {
        return workspaceId + ":" + leadId;
    }

    private static String resultColumn(PipelineStage stage) {
        return switch (stage) {
            case MINING -> "mined_json";
            case VALIDATION -> "validated_json";
            case SYNTHESIS -> "synthesized_json";
        };
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalArgumentException("Unable to serialize value as JSON", e);
        }
    }

    private Map<String, Object> readJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, JSON_OBJECT);
            return parsed == null ? Map.of() : parsed;
        } catch (Exception e) {
            log.warn("Unreadable stage result payload; treating as empty", e);
            return Map.of();
        }
    }

    private Map<String, String> readStringMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, String> parsed = objectMapper.readValue(json, STRING_MAP);
            return parsed == null ? Map.of() : parsed;
        } catch (Exception e) {
            log.warn("Unreadable lead input payload; treating as empty", e);
            return Map.of();
        }
    }
}
