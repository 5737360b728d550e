package com.prospectpulse.enrichment.model;

public record WorkerDrainResponse(
    int processed,
    int retried,
    JobQueueStats queueStats
) {
}
