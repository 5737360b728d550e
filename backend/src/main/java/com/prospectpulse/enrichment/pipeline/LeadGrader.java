package com.prospectpulse.enrichment.pipeline;

import java.util.Map;

public final class LeadGrader {
    private LeadGrader() {
    }

    public static String grade(Map<String, Object> synthesized) {
        if (synthesized == null) {
            throw new IllegalArgumentException("grade requires a synthesized result");
        }
        int score = synthesized.get("fit_score") instanceof Number number ? number.intValue() : 0;
        if (score >= 85) {
            return "A";
        }
        if (score >= 70) {
            return "B";
        }
        if (score >= 50) {
            return "C";
        }
        return "D";
    }
}
