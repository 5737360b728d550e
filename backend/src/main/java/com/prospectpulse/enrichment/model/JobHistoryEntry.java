package com.prospectpulse.enrichment.model;

import java.time.Instant;

public record JobHistoryEntry(
    String jobId,
    JobStatus status,
    Instant recordedAt
) {
}
