package com.prospectpulse.enrichment.pipeline;

import com.prospectpulse.enrichment.model.JobStatus;

import java.time.Duration;

public record ExecutionOutcome(
    Kind kind,
    JobStatus status,
    String reason,
    Duration retryAfter
) {

    public enum Kind {
        SUCCEEDED,
        FAILED,
        RETRY,
        SKIPPED
    }

    public static ExecutionOutcome succeeded(JobStatus status) {
        return new ExecutionOutcome(Kind.SUCCEEDED, status, null, Duration.ZERO);
    }

    public static ExecutionOutcome failed(JobStatus status) {
        return new ExecutionOutcome(Kind.FAILED, status, status.reason(), Duration.ZERO);
    }

    public static ExecutionOutcome retry(JobStatus status, String reason, Duration retryAfter) {
        return new ExecutionOutcome(Kind.RETRY, status, reason, retryAfter == null ? Duration.ZERO : retryAfter);
    }

    public static ExecutionOutcome skipped(JobStatus status) {
        return new ExecutionOutcome(Kind.SKIPPED, status, null, Duration.ZERO);
    }
}
