package com.prospectpulse.enrichment.model;

public final class FailureReasons {
    public static final String INVALID_INPUT = "invalid_input";
    public static final String INVALID_CONTACT = "invalid_contact";
    public static final String PROVIDER_REJECTED = "provider_rejected";
    public static final String LEAD_NOT_FOUND = "lead_not_found";
    public static final String RETRIES_EXHAUSTED = "retries_exhausted";
    public static final String RATE_LIMITED = "rate_limited";
    public static final String PROVIDER_TIMEOUT = "provider_timeout";
    public static final String PROVIDER_5XX = "provider_5xx";
    public static final String STAGE_EXCEPTION = "stage_exception";
    public static final String UNKNOWN = "unknown";

    private FailureReasons() {
    }
}
