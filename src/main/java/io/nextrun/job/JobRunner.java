package io.nextrun.job;

import io.nextrun.config.AsyncConfig;
import io.nextrun.core.ReasoningEngine;
import io.nextrun.notify.NotificationDispatcher;
import io.nextrun.notify.NotificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs one job in the background: optional delay, one reasoning-engine call,
 * a completion notification, and release of the task slot.
 *
 * <p>The delay is scheduled with {@link CompletableFuture#delayedExecutor}, so no
 * worker thread is held while waiting. Engine failures end in a FAILED job and an
 * error notification. Exceptions stop there; an {@link Error} is rethrown once the
 * job is marked FAILED and reported. The slot is released exactly once, even if
 * notifying fails.</p>
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final int LOG_RESULT_LENGTH = 1000;

    private final ReasoningEngine reasoningEngine;
    private final NotificationDispatcher notificationDispatcher;
    private final TaskRegistry taskRegistry;
    private final ExecutorService jobExecutor;

    public JobRunner(ReasoningEngine reasoningEngine, NotificationDispatcher notificationDispatcher,
                     TaskRegistry taskRegistry, @Qualifier(AsyncConfig.JOB_EXECUTOR) ExecutorService jobExecutor) {
        this.reasoningEngine = reasoningEngine;
        this.notificationDispatcher = notificationDispatcher;
        this.taskRegistry = taskRegistry;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Starts a job on the job executor.
     *
     * @param handle the task handle the job is registered under
     * @param job    the job to run
     * @return a future completing after the slot has been released; callers do not wait on it
     * @throws java.util.concurrent.RejectedExecutionException if the executor does not accept the job
     */
    public CompletableFuture<Void> run(long handle, Job job) {
        Executor executor = job.getDelaySeconds() > 0
                ? CompletableFuture.delayedExecutor(job.getDelaySeconds(), TimeUnit.SECONDS, jobExecutor)
                : jobExecutor;
        return CompletableFuture.runAsync(() -> execute(handle, job), executor);
    }

    void execute(long handle, Job job) {
        try {
            log.info("Job {} | start background | input={}", job.getJobId(), job.getInput());
            job.markRunning();

            String result;
            try {
                result = reasoningEngine.invoke(job.getInput());
            } catch (Exception e) {
                fail(job, e);
                return;
            } catch (Error e) {
                fail(job, e);
                throw e;
            }

            job.markCompleted();
            log.info("Job {} | completed | result={}", job.getJobId(), abbreviate(result));
            notifyQuietly(job, NotificationStatus.SUCCESS, "Agent run completed successfully", result);
        } finally {
            taskRegistry.release(handle);
            log.info("Job {} | task {} released", job.getJobId(), handle);
        }
    }

    private void fail(Job job, Throwable cause) {
        job.markFailed();
        log.error("Job {} failed: {}", job.getJobId(), cause.getMessage(), cause);
        notifyQuietly(job, NotificationStatus.ERROR,
                "Agent run failed with an error: " + cause.getMessage(), null);
    }

    private void notifyQuietly(Job job, NotificationStatus status, String message, String result) {
        try {
            notificationDispatcher.notify(job.getJobId(), status, message, result);
        } catch (RuntimeException e) {
            log.error("Notification for job {} failed: {}", job.getJobId(), e.getMessage(), e);
        }
    }

    private static String abbreviate(String result) {
        if (result == null) {
            return "";
        }
        return result.length() > LOG_RESULT_LENGTH ? result.substring(0, LOG_RESULT_LENGTH) : result;
    }
}
