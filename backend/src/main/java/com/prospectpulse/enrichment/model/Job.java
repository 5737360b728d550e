package com.prospectpulse.enrichment.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Job(
    @JsonProperty("job_id") String id,
    String leadId,
    String workspaceId,
    JobStatus status,
    Instant createdAt,
    Instant updatedAt,
    int retryCount,
    @JsonIgnore long version,
    @JsonIgnore String leaseOwner,
    @JsonIgnore Instant leaseUntil
) {

    @JsonProperty("failure_reason")
    public String failureReason() {
        return status.reason();
    }

    @JsonProperty("progress")
    public double progress() {
        if (status.state() == JobState.FAILED) {
            return 1.0;
        }
        double steps = PipelineStage.values().length + 2;
        return Math.round(status.position() / steps * 100.0) / 100.0;
    }

    @JsonProperty("terminal")
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isLeasedAt(Instant now) {
        return leaseOwner != null && leaseUntil != null && leaseUntil.isAfter(now);
    }
}
