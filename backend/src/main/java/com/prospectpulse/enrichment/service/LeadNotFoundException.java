package com.prospectpulse.enrichment.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class LeadNotFoundException extends RuntimeException {
    private final String leadId;

    public LeadNotFoundException(String leadId) {
        super("Lead not found: " + leadId);
        this.leadId = leadId;
    }

    public String getLeadId() {
        return leadId;
    }
}
