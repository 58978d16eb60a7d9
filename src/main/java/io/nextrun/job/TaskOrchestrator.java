package io.nextrun.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.RejectedExecutionException;

/**
 * Dispatches jobs to the background and hands back a task handle immediately.
 * Nothing here waits on a job.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final TaskRegistry taskRegistry;
    private final JobRunner jobRunner;

    public TaskOrchestrator(TaskRegistry taskRegistry, JobRunner jobRunner) {
        this.taskRegistry = taskRegistry;
        this.jobRunner = jobRunner;
    }

    /**
     * Registers the job and launches it without waiting for it to finish.
     *
     * @return the task handle
     * @throws RejectedExecutionException if the job executor is saturated or shut down;
     *                                    the slot is released before rethrowing
     */
    public long start(Job job) {
        long handle = taskRegistry.register(job);
        try {
            jobRunner.run(handle, job);
        } catch (RejectedExecutionException e) {
            taskRegistry.release(handle);
            log.error("Job {} could not be started: {}", job.getJobId(), e.getMessage());
            throw e;
        }
        log.info("Job {} dispatched as task {} (delay {}s)", job.getJobId(), handle, job.getDelaySeconds());
        return handle;
    }

    /**
     * Removes bookkeeping for a finished task. Safe to call for an unknown handle.
     */
    public void release(long handle) {
        taskRegistry.release(handle);
    }
}
