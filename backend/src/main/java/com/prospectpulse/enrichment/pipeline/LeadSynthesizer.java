package com.prospectpulse.enrichment.pipeline;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.FailureReasons;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.PipelineStage;
import com.prospectpulse.enrichment.ratelimit.ProviderRateLimiter;
import com.prospectpulse.enrichment.ratelimit.RateLimitDecision;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class LeadSynthesizer implements StageRunner {
    private static final int RISK_PENALTY = 5;

    private final ProspectProperties properties;

    public LeadSynthesizer(ProspectProperties properties) {
        this.properties = properties;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.SYNTHESIS;
    }

    @Override
    public StageOutcome run(Lead lead, ProviderRateLimiter rateLimiter) {
        if (lead.mined() == null || lead.validated() == null) {
            return StageOutcome.permanentFailure(FailureReasons.INVALID_INPUT);
        }
        RateLimitDecision decision = rateLimiter.acquire(properties.getStages().getSynthesizerProvider());
        if (!decision.granted()) {
            return StageOutcome.transientFailure(FailureReasons.RATE_LIMITED, decision.retryAfter());
        }

        String company = lead.company() == null ? "Unknown Co" : lead.company();
        List<String> signals = stringList(lead.mined().get("signals"));
        List<String> risks = stringList(lead.validated().get("risks"));
        int baseScore = signals.isEmpty() ? 70 : 90;
        int score = Math.max(0, Math.min(100, baseScore - risks.size() * RISK_PENALTY));

        String wedge = company + " can trim tooling costs with bundled pricing.";
        if (String.join(" ", signals).toLowerCase(Locale.ROOT).contains("cost")) {
            wedge = company + " faces cost pressure; lead with ROI and consolidation.";
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("company", company);
        payload.put("fit_score", score);
        payload.put("wedge", wedge);
        payload.put("tech_stack", stringList(lead.validated().get("tech_stack")));
        payload.put("signals", signals);
        return StageOutcome.success(payload);
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().map(String::valueOf).toList();
    }
}
