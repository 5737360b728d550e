package com.prospectpulse.enrichment.pipeline;

import java.time.Duration;
import java.util.Map;

public record StageOutcome(
    Kind kind,
    Map<String, Object> payload,
    String reason,
    Duration retryAfter
) {

    public enum Kind {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    public static StageOutcome success(Map<String, Object> payload) {
        return new StageOutcome(Kind.SUCCESS, Map.copyOf(payload), null, Duration.ZERO);
    }

    public static StageOutcome transientFailure(String reason, Duration retryAfter) {
        return new StageOutcome(Kind.TRANSIENT_FAILURE, null, reason, retryAfter == null ? Duration.ZERO : retryAfter);
    }

    public static StageOutcome permanentFailure(String reason) {
        return new StageOutcome(Kind.PERMANENT_FAILURE, null, reason, Duration.ZERO);
    }
}
