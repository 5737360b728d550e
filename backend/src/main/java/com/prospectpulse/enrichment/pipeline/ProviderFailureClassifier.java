package com.prospectpulse.enrichment.pipeline;

import com.prospectpulse.enrichment.model.FailureReasons;

public final class ProviderFailureClassifier {

    private ProviderFailureClassifier() {}

    public static StageOutcome classify(ProviderCallException failure) {
        Integer status = failure.getHttpStatus();
        if (status == null || status <= 0) {
            return StageOutcome.transientFailure(FailureReasons.STAGE_EXCEPTION, failure.getRetryAfter());
        }
        if (status == 408 || status == 504) {
            return StageOutcome.transientFailure(FailureReasons.PROVIDER_TIMEOUT, failure.getRetryAfter());
        }
        if (status == 429) {
            return StageOutcome.transientFailure(FailureReasons.RATE_LIMITED, failure.getRetryAfter());
        }
        if (status >= 500 && status < 600) {
            return StageOutcome.transientFailure(FailureReasons.PROVIDER_5XX, failure.getRetryAfter());
        }
        if (status >= 400 && status < 500) {
            return StageOutcome.permanentFailure(FailureReasons.PROVIDER_REJECTED);
        }
        return StageOutcome.transientFailure(FailureReasons.STAGE_EXCEPTION, failure.getRetryAfter());
    }
}
