package com.prospectpulse.enrichment.model;

import java.util.List;

public record LeadPage(
    String workspaceId,
    List<Lead> items,
    int page,
    int size,
    long total
) {
}
