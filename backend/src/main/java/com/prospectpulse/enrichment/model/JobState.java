package com.prospectpulse.enrichment.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobState {
    QUEUED("queued"),
    RUNNING("running"),
    STAGE_COMPLETE("stage_complete"),
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String key;

    JobState(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public static JobState fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (JobState state : values()) {
            if (state.key.equals(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown job state: " + key);
    }
}
