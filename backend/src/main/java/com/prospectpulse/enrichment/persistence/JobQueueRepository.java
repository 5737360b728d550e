package com.prospectpulse.enrichment.persistence;

import com.prospectpulse.enrichment.model.JobQueueStats;
import com.prospectpulse.enrichment.service.QueueUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Job-ready notifications backed by the {@code job_queue} table. Messages carry only the job id.
 */
@Repository
public class JobQueueRepository {
    private static final int CLAIM_CANDIDATES = 5;

    private final NamedParameterJdbcTemplate jdbc;

    public JobQueueRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isReachable() {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM job_queue WHERE 1 = 0", Integer.class);
            return value != null;
        } catch (DataAccessException e) {
            return false;
        }
    }

    public void enqueue(String jobId) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("now", Timestamp.from(now));
        try {
            try {
                jdbc.update(
                    """
                        INSERT INTO job_queue (job_id, available_at, deliveries, enqueued_at, updated_at)
                        VALUES (:jobId, :now, 0, :now, :now)
                        """,
                    params
                );
            } catch (DuplicateKeyException ignored) {
                jdbc.update(
                    """
                        UPDATE job_queue
                        SET available_at = :now,
                            updated_at = :now
                        WHERE job_id = :jobId
                          AND (locked_until IS NULL OR locked_until < :now)
                        """,
                    params
                );
            }
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Unable to enqueue job " + jobId, e);
        }
    }

    public String claimNext(String lockOwner, long lockTtlSeconds) {
        Instant now = Instant.now();
        Instant lockedUntil = now.plusSeconds(Math.max(1, lockTtlSeconds));
        String safeOwner = (lockOwner == null || lockOwner.isBlank()) ? "unknown" : lockOwner.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(lockedUntil))
            .addValue("lockOwner", safeOwner)
            .addValue("limit", CLAIM_CANDIDATES);

        List<String> candidates = jdbc.query(
            """
                SELECT job_id
                FROM job_queue
                WHERE available_at <= :now
                  AND (locked_until IS NULL OR locked_until < :now)
                ORDER BY available_at ASC, enqueued_at ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getString("job_id")
        );
        for (String candidate : candidates) {
            params.addValue("jobId", candidate);
            int updated = jdbc.update(
                """
                    UPDATE job_queue
                    SET locked_until = :lockedUntil,
                        lock_owner = :lockOwner,
                        deliveries = deliveries + 1,
                        updated_at = :now
                    WHERE job_id = :jobId
                      AND available_at <= :now
                      AND (locked_until IS NULL OR locked_until < :now)
                    """,
                params
            );
            if (updated == 1) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Blocks up to {@code timeout}, polling every {@code pollInterval}, and returns {@code null} when nothing became ready.
     */
    public String dequeue(String lockOwner, long lockTtlSeconds, Duration timeout, Duration pollInterval) {
        Instant deadline = Instant.now().plus(timeout);
        while (true) {
            String jobId = claimNext(lockOwner, lockTtlSeconds);
            if (jobId != null) {
                return jobId;
            }
            if (!Instant.now().isBefore(deadline) || Thread.currentThread().isInterrupted()) {
                return null;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(Math.max(10, pollInterval.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
    }

    public void ack(String jobId) {
        jdbc.update(
            "DELETE FROM job_queue WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId)
        );
    }

    /**
     * Makes the message deliverable again after {@code retryAfter}, re-creating it if another owner already acked it.
     */
    public void nack(String jobId, Duration retryAfter) {
        Instant now = Instant.now();
        Duration safeDelay = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("availableAt", Timestamp.from(now.plus(safeDelay)))
            .addValue("now", Timestamp.from(now));
        if (releaseWithDelay(params) > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO job_queue (job_id, available_at, deliveries, enqueued_at, updated_at)
                    VALUES (:jobId, :availableAt, 0, :now, :now)
                    """,
                params
            );
        } catch (DuplicateKeyException ignored) {
            releaseWithDelay(params);
        }
    }

    private int releaseWithDelay(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE job_queue
                SET available_at = :availableAt,
                    locked_until = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE job_id = :jobId
                """,
            params
        );
    }

    public boolean contains(String jobId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_queue WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId),
            Integer.class
        );
        return count != null && count > 0;
    }

    public JobQueueStats fetchQueueStats() {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(Instant.now()));
        Long readyCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM job_queue
                WHERE available_at <= :now
                  AND (locked_until IS NULL OR locked_until < :now)
                """,
            params,
            Long.class
        );
        Long lockedCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM job_queue
                WHERE locked_until IS NOT NULL
                  AND locked_until >= :now
                """,
            params,
            Long.class
        );
        Long delayedCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM job_queue
                WHERE available_at > :now
                  AND (locked_until IS NULL OR locked_until < :now)
                """,
            params,
            Long.class
        );
        Timestamp nextAvailable = jdbc.queryForObject(
            """
                SELECT MIN(available_at)
                FROM job_queue
                WHERE locked_until IS NULL OR locked_until < :now
                """,
            params,
            Timestamp.class
        );
        return new JobQueueStats(
            readyCount == null ? 0L : readyCount,
            lockedCount == null ? 0L : lockedCount,
            delayedCount == null ? 0L : delayedCount,
            nextAvailable == null ? null : nextAvailable.toInstant()
        );
    }
}
