package com.prospectpulse.enrichment.ratelimit;

import java.time.Duration;

public record RateLimitDecision(String provider, boolean granted, Duration retryAfter) {

    public static RateLimitDecision granted(String provider) {
        return new RateLimitDecision(provider, true, Duration.ZERO);
    }

    public static RateLimitDecision wouldBlock(String provider, Duration retryAfter) {
        return new RateLimitDecision(provider, false, retryAfter);
    }
}
