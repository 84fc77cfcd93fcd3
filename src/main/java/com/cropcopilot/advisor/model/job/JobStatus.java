package com.cropcopilot.advisor.model.job;

/**
 * Lifecycle of a recommendation job. A job moves forward through the
 * working states to COMPLETED, or to FAILED from any of them.
 */
public enum JobStatus {
    QUEUED,
    RETRIEVING_CONTEXT,
    GENERATING_RECOMMENDATION,
    VALIDATING_OUTPUT,
    PERSISTING_RESULT,
    COMPLETED,
    FAILED;

    /**
     * Only queued jobs and failed jobs being redriven may be (re)started.
     */
    public boolean isStartable() {
        return this == QUEUED || this == FAILED;
    }
}
