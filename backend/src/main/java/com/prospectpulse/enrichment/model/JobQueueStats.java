package com.prospectpulse.enrichment.model;

import java.time.Instant;

public record JobQueueStats(
    long readyCount,
    long lockedCount,
    long delayedCount,
    Instant nextAvailableAt
) {
}
