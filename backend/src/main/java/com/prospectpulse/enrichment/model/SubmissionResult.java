package com.prospectpulse.enrichment.model;

public record SubmissionResult(
    String jobId,
    String leadId,
    String workspaceId,
    DeliveryMode delivery
) {
}
