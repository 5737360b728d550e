package com.prospectpulse.enrichment.ratelimit;

import java.time.Duration;
import java.util.function.LongSupplier;

final class TokenBucket {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final double ratePerSecond;
    private final int capacity;
    private final LongSupplier nanoClock;
    private double tokens;
    private long refilledAt;

    TokenBucket(double ratePerSecond, int capacity, LongSupplier nanoClock) {
        this.ratePerSecond = ratePerSecond;
        this.capacity = capacity;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.refilledAt = nanoClock.getAsLong();
    }

    /**
     * Takes one token if available and returns {@link Duration#ZERO}; otherwise returns how long until one is.
     */
    synchronized Duration tryConsume() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return Duration.ZERO;
        }
        double missing = 1.0 - tokens;
        long waitNanos = (long) Math.ceil(missing / ratePerSecond * NANOS_PER_SECOND);
        return Duration.ofNanos(Math.max(1, waitNanos));
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - refilledAt;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsed / NANOS_PER_SECOND * ratePerSecond);
        refilledAt = now;
    }
}
