package com.prospectpulse.enrichment.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record Lead(
    @JsonProperty("lead_id") String id,
    String workspaceId,
    Map<String, String> rawInput,
    Map<String, Object> mined,
    Map<String, Object> validated,
    Map<String, Object> synthesized,
    String grade,
    Instant createdAt,
    Instant updatedAt
) {

    public Map<String, Object> result(PipelineStage stage) {
        return switch (stage) {
            case MINING -> mined;
            case VALIDATION -> validated;
            case SYNTHESIS -> synthesized;
        };
    }

    public boolean hasResult(PipelineStage stage) {
        return result(stage) != null;
    }

    @JsonIgnore
    public String company() {
        return firstNonBlank("company", "name");
    }

    @JsonIgnore
    public String contact() {
        return firstNonBlank("contact", "email");
    }

    private String firstNonBlank(String... keys) {
        if (rawInput == null) {
            return null;
        }
        for (String key : keys) {
            String value = rawInput.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
