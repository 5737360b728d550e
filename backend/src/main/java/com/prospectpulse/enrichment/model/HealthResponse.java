package com.prospectpulse.enrichment.model;

public record HealthResponse(
    String status,
    boolean storeReachable,
    boolean queueEnabled,
    boolean queueReachable
) {
}
