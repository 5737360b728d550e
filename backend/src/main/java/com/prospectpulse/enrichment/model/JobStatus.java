package com.prospectpulse.enrichment.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

public record JobStatus(JobState state, PipelineStage stage, String reason) {

    public JobStatus {
        Objects.requireNonNull(state, "state");
        if (state == JobState.STAGE_COMPLETE && stage == null) {
            throw new IllegalArgumentException("stage_complete requires a stage");
        }
        if (state != JobState.STAGE_COMPLETE) {
            stage = null;
        }
        if (state == JobState.FAILED) {
            reason = reason == null || reason.isBlank() ? FailureReasons.UNKNOWN : reason;
        } else {
            reason = null;
        }
    }

    public static JobStatus queued() {
        return new JobStatus(JobState.QUEUED, null, null);
    }

    public static JobStatus running() {
        return new JobStatus(JobState.RUNNING, null, null);
    }

    public static JobStatus stageComplete(PipelineStage stage) {
        return new JobStatus(JobState.STAGE_COMPLETE, stage, null);
    }

    public static JobStatus succeeded() {
        return new JobStatus(JobState.SUCCEEDED, null, null);
    }

    public static JobStatus failed(String reason) {
        return new JobStatus(JobState.FAILED, null, reason);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Position along the happy path: queued=0, running=1, one step per completed stage, succeeded last.
     * Failed has no position.
     */
    public int position() {
        return switch (state) {
            case QUEUED -> 0;
            case RUNNING -> 1;
            case STAGE_COMPLETE -> 2 + stage.ordinal();
            case SUCCEEDED -> 2 + PipelineStage.values().length;
            case FAILED -> -1;
        };
    }

    public boolean hasCompleted(PipelineStage candidate) {
        if (state == JobState.SUCCEEDED) {
            return true;
        }
        return state == JobState.STAGE_COMPLETE && stage.ordinal() >= candidate.ordinal();
    }

    public boolean canTransitionTo(JobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next.state() == JobState.FAILED) {
            return state != JobState.QUEUED;
        }
        return next.position() == position() + 1;
    }

    @JsonValue
    public String label() {
        if (state == JobState.STAGE_COMPLETE) {
            return state.key() + "(" + stage.key() + ")";
        }
        if (state == JobState.FAILED) {
            return state.key() + "(" + reason + ")";
        }
        return state.key();
    }

    @Override
    public String toString() {
        return label();
    }
}
