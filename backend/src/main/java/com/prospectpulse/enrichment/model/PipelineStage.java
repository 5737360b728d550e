package com.prospectpulse.enrichment.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PipelineStage {
    MINING("mining"),
    VALIDATION("validation"),
    SYNTHESIS("synthesis");

    private final String key;

    PipelineStage(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static PipelineStage fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (PipelineStage stage : values()) {
            if (stage.key.equals(normalized)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown pipeline stage: " + key);
    }
}
