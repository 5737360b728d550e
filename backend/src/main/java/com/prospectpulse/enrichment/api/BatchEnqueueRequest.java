package com.prospectpulse.enrichment.api;

import java.util.List;
import java.util.Map;

public record BatchEnqueueRequest(
    List<Map<String, String>> leads,
    String workspaceId,
    Boolean force
) {
}
