package io.nextrun.job;

/**
 * One unit of background work.
 *
 * <p>Created {@link JobStatus#PENDING} at dispatch. Only {@link JobRunner} moves
 * the status forward; everything else just reads it.</p>
 */
public class Job {

    private final String jobId;
    private final String input;
    private final int delaySeconds;
    private volatile JobStatus status = JobStatus.PENDING;

    public Job(String jobId, String input, int delaySeconds) {
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds must not be negative: " + delaySeconds);
        }
        this.jobId = jobId;
        this.input = input;
        this.delaySeconds = delaySeconds;
    }

    public String getJobId() {
        return jobId;
    }

    public String getInput() {
        return input;
    }

    public int getDelaySeconds() {
        return delaySeconds;
    }

    public JobStatus getStatus() {
        return status;
    }

    void markRunning() {
        status = JobStatus.RUNNING;
    }

    void markCompleted() {
        status = JobStatus.COMPLETED;
    }

    void markFailed() {
        status = JobStatus.FAILED;
    }

    @Override
    public String toString() {
        return "Job[" + jobId + ", " + status + "]";
    }
}
