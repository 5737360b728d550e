package com.prospectpulse.enrichment.pipeline;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.FailureReasons;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.PipelineStage;
import com.prospectpulse.enrichment.ratelimit.ProviderRateLimiter;
import com.prospectpulse.enrichment.ratelimit.RateLimitDecision;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class LeadMiner implements StageRunner {
    private final ProspectProperties properties;

    public LeadMiner(ProspectProperties properties) {
        this.properties = properties;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.MINING;
    }

    @Override
    public StageOutcome run(Lead lead, ProviderRateLimiter rateLimiter) {
        String company = lead.company();
        if (company == null) {
            return StageOutcome.permanentFailure(FailureReasons.INVALID_INPUT);
        }
        RateLimitDecision decision = rateLimiter.acquire(properties.getStages().getMinerProvider());
        if (!decision.granted()) {
            return StageOutcome.transientFailure(FailureReasons.RATE_LIMITED, decision.retryAfter());
        }

        List<String> signals = new ArrayList<>();
        signals.add(company + " discussed cost pressure in community forums");
        signals.add(company + " is evaluating cloud spend reduction");
        String industry = lead.rawInput().get("industry");
        if (industry != null) {
            signals.add(company + " is hiring across " + industry + " operations");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("company", company);
        payload.put("signals", signals);
        payload.put("provider", decision.provider());
        return StageOutcome.success(payload);
    }
}
