package com.prospectpulse.enrichment.model;

public record WorkerStatusResponse(
    boolean queueEnabled,
    boolean running,
    int workerCount,
    JobQueueStats queueStats
) {
}
