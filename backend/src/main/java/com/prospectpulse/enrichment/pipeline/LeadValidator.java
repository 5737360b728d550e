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
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class LeadValidator implements StageRunner {
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@([^@\\s]+\\.[^@\\s]+)$");

    private final ProspectProperties properties;

    public LeadValidator(ProspectProperties properties) {
        this.properties = properties;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.VALIDATION;
    }

    @Override
    public StageOutcome run(Lead lead, ProviderRateLimiter rateLimiter) {
        String company = lead.company();
        if (company == null) {
            return StageOutcome.permanentFailure(FailureReasons.INVALID_INPUT);
        }
        String contact = lead.contact();
        String emailDomain = null;
        if (contact != null && contact.contains("@")) {
            var matcher = EMAIL.matcher(contact);
            if (!matcher.matches()) {
                return StageOutcome.permanentFailure(FailureReasons.INVALID_CONTACT);
            }
            emailDomain = matcher.group(1).toLowerCase(Locale.ROOT);
        }
        RateLimitDecision decision = rateLimiter.acquire(properties.getStages().getValidatorProvider());
        if (!decision.granted()) {
            return StageOutcome.transientFailure(FailureReasons.RATE_LIMITED, decision.retryAfter());
        }

        List<String> risks = new ArrayList<>();
        risks.add("Unknown budget owner");
        if (emailDomain != null && !domainMatchesCompany(emailDomain, company)) {
            risks.add("Contact domain does not match company");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("company", company);
        payload.put("tech_stack", List.of("AWS", "Salesforce"));
        payload.put("risks", risks);
        if (emailDomain != null) {
            payload.put("email_domain", emailDomain);
        }
        return StageOutcome.success(payload);
    }

    static boolean domainMatchesCompany(String domain, String company) {
        String label = domain.split("\\.")[0];
        String token = company.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        return !label.isEmpty() && (token.startsWith(label) || label.startsWith(token));
    }
}
