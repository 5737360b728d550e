package com.prospectpulse.enrichment.service;

import java.time.Duration;

public record WorkerDisposition(Kind kind, Duration delay) {

    public enum Kind {
        DONE,
        RETRY_AFTER,
        DEFERRED
    }

    public static WorkerDisposition done() {
        return new WorkerDisposition(Kind.DONE, Duration.ZERO);
    }

    public static WorkerDisposition retryAfter(Duration delay) {
        return new WorkerDisposition(Kind.RETRY_AFTER, delay);
    }

    /**
     * Puts the message back without counting an attempt, used while another owner holds the job lease.
     */
    public static WorkerDisposition deferred(Duration delay) {
        return new WorkerDisposition(Kind.DEFERRED, delay);
    }

    public boolean isDone() {
        return kind == Kind.DONE;
    }
}
