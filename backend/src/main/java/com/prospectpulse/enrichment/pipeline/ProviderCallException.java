package com.prospectpulse.enrichment.pipeline;

import java.time.Duration;

/**
 * Raised by a stage when its external provider answers with an error. {@code httpStatus} is null for transport
 * failures.
 */
public class ProviderCallException extends RuntimeException {
    private final String provider;
    private final Integer httpStatus;
    private final Duration retryAfter;

    public ProviderCallException(String provider, Integer httpStatus, Duration retryAfter, String message) {
        super(message);
        this.provider = provider;
        this.httpStatus = httpStatus;
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public String getProvider() {
        return provider;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
