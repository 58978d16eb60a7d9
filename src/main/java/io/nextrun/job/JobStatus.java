package io.nextrun.job;

/**
 * Lifecycle of a background job: PENDING → RUNNING → COMPLETED | FAILED.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
