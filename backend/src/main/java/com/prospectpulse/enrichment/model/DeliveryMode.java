package com.prospectpulse.enrichment.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryMode {
    QUEUED("queued"),
    INLINE("inline");

    private final String key;

    DeliveryMode(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
