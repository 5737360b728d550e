package com.prospectpulse.enrichment.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateActiveJobException extends RuntimeException {
    private final String leadId;
    private final String workspaceId;
    private final String activeJobId;

    public DuplicateActiveJobException(String leadId, String workspaceId, String activeJobId) {
        super("Active job already exists for lead " + leadId + " in workspace " + workspaceId);
        this.leadId = leadId;
        this.workspaceId = workspaceId;
        this.activeJobId = activeJobId;
    }

    public String getLeadId() {
        return leadId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getActiveJobId() {
        return activeJobId;
    }
}
