package com.prospectpulse.enrichment.ratelimit;

import com.prospectpulse.config.ProspectProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

@Component
public class ProviderRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(ProviderRateLimiter.class);

    private final ProspectProperties properties;
    private final LongSupplier nanoClock;
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    @Autowired
    public ProviderRateLimiter(ProspectProperties properties) {
        this(properties, System::nanoTime);
    }

    ProviderRateLimiter(ProspectProperties properties, LongSupplier nanoClock) {
        this.properties = properties;
        this.nanoClock = nanoClock;
    }

    /**
     * Grants a call to {@code provider} when a token is free, or when one frees up within the provider's acquire
     * timeout. Never retries beyond that; callers surface {@code wouldBlock} as a transient failure.
     */
    public RateLimitDecision acquire(String provider) {
        String key = normalizeProvider(provider);
        ProspectProperties.Provider limits = properties.getRateLimit().forProvider(key);
        TokenBucket bucket = buckets.computeIfAbsent(
            key,
            ignored -> new TokenBucket(limits.getRatePerSecond(), limits.getCapacity(), nanoClock)
        );
        Duration wait = bucket.tryConsume();
        if (wait.isZero()) {
            return RateLimitDecision.granted(key);
        }
        long timeoutMs = limits.getAcquireTimeoutMs();
        if (timeoutMs > 0 && wait.toMillis() <= timeoutMs) {
            try {
                TimeUnit.NANOSECONDS.sleep(wait.toNanos());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RateLimitDecision.wouldBlock(key, wait);
            }
            Duration retryWait = bucket.tryConsume();
            if (retryWait.isZero()) {
                return RateLimitDecision.granted(key);
            }
            wait = retryWait;
        }
        log.debug("Rate limit would block provider {} for {} ms", key, wait.toMillis());
        return RateLimitDecision.wouldBlock(key, wait);
    }

    public double availableTokens(String provider) {
        TokenBucket bucket = buckets.get(normalizeProvider(provider));
        if (bucket == null) {
            return properties.getRateLimit().forProvider(provider).getCapacity();
        }
        return bucket.availableTokens();
    }

    private static String normalizeProvider(String provider) {
        if (provider == null || provider.isBlank()) {
            return "default";
        }
        return provider.trim().toLowerCase(Locale.ROOT);
    }
}
