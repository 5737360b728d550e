package com.prospectpulse.enrichment.pipeline;

import com.prospectpulse.enrichment.model.FailureReasons;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProviderFailureClassifierTest {

    @Test
    void timeoutsAndServerErrorsAreTransient() {
        assertTransient(FailureReasons.PROVIDER_TIMEOUT, 504);
        assertTransient(FailureReasons.PROVIDER_TIMEOUT, 408);
        assertTransient(FailureReasons.PROVIDER_5XX, 502);
        assertTransient(FailureReasons.STAGE_EXCEPTION, null);
    }

    @Test
    void throttlingKeepsProviderRetryAfter() {
        StageOutcome outcome = ProviderFailureClassifier.classify(
            new ProviderCallException("llm", 429, Duration.ofSeconds(7), "slow down")
        );

        assertEquals(StageOutcome.Kind.TRANSIENT_FAILURE, outcome.kind());
        assertEquals(FailureReasons.RATE_LIMITED, outcome.reason());
        assertEquals(Duration.ofSeconds(7), outcome.retryAfter());
    }

    @Test
    void clientErrorsAreProviderRejections() {
        StageOutcome outcome = ProviderFailureClassifier.classify(
            new ProviderCallException("enrichment", 422, null, "unprocessable lead")
        );

        assertEquals(StageOutcome.Kind.PERMANENT_FAILURE, outcome.kind());
        assertEquals(FailureReasons.PROVIDER_REJECTED, outcome.reason());
    }

    private static void assertTransient(String reason, Integer status) {
        StageOutcome outcome = ProviderFailureClassifier.classify(new ProviderCallException("search", status, null, "failed"));
        assertEquals(StageOutcome.Kind.TRANSIENT_FAILURE, outcome.kind(), "status " + status);
        assertEquals(reason, outcome.reason(), "status " + status);
    }
}
