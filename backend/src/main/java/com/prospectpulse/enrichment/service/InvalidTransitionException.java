package com.prospectpulse.enrichment.service;

import com.prospectpulse.enrichment.model.JobStatus;

/**
 * Thrown when a job row cannot move to the requested status, either because the move is illegal or because
 * another worker owns the job.
 */
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String jobId, JobStatus current, JobStatus requested) {
        this(jobId, "illegal transition " + current + " -> " + requested);
    }

    public InvalidTransitionException(String jobId, String message) {
        super("Job " + jobId + ": " + message);
    }
}
