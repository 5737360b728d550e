package com.prospectpulse.enrichment.pipeline;

import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.PipelineStage;
import com.prospectpulse.enrichment.ratelimit.ProviderRateLimiter;

/**
 * One fixed step of the enrichment pipeline. Implementations take a token from the rate limiter before calling
 * out and report a denied token as a transient failure instead of waiting.
 */
public interface StageRunner {

    PipelineStage stage();

    StageOutcome run(Lead lead, ProviderRateLimiter rateLimiter);
}
