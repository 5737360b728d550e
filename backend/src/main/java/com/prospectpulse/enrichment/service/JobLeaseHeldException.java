package com.prospectpulse.enrichment.service;

import java.time.Instant;

/**
 * Thrown when a claim loses to another owner's live lease. {@code leaseUntil} is null when the claim lost repeated
 * version races instead.
 */
public class JobLeaseHeldException extends InvalidTransitionException {
    private final String leaseOwner;
    private final Instant leaseUntil;

    public JobLeaseHeldException(String jobId, String leaseOwner, Instant leaseUntil) {
        super(jobId, leaseOwner == null ? "claim lost repeated version races" : "leased by " + leaseOwner + " until " + leaseUntil);
        this.leaseOwner = leaseOwner;
        this.leaseUntil = leaseUntil;
    }

    public String getLeaseOwner() {
        return leaseOwner;
    }

    public Instant getLeaseUntil() {
        return leaseUntil;
    }
}
