package com.prospectpulse.enrichment.api;

import java.util.Map;

public record EnqueueRequest(
    Map<String, String> leadInput,
    String workspaceId,
    Boolean force
) {
}
