package com.prospectpulse.enrichment.model;

public record BatchSubmissionItem(
    int index,
    String jobId,
    String leadId,
    String error
) {
}
