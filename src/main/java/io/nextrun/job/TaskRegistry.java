package io.nextrun.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory table of in-flight background tasks, keyed by task handle.
 *
 * <p>Handles are unique within the process and are not reused. Nothing here
 * survives a restart.</p>
 *
 * <p>Thread-safe: tasks are registered by request threads and released by job threads.</p>
 */
@Component
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<Long, InFlightTask> tasks = new ConcurrentHashMap<>();
    private final AtomicLong nextHandle = new AtomicLong(1);
    private final AtomicReference<Instant> lastStatusChange;
    private final Clock clock;

    public TaskRegistry(Clock clock) {
        this.clock = clock;
        this.lastStatusChange = new AtomicReference<>(clock.instant());
    }

    /**
     * Registers a job under a fresh handle.
     */
    public long register(Job job) {
        long handle = nextHandle.getAndIncrement();
        tasks.put(handle, new InFlightTask(handle, job, clock.instant()));
        lastStatusChange.set(clock.instant());
        log.debug("Registered task {} for job {}", handle, job.getJobId());
        return handle;
    }

    /**
     * Removes a finished task. Releasing an unknown handle is logged and ignored.
     *
     * @return true if the handle was registered
     */
    public boolean release(long handle) {
        InFlightTask removed = tasks.remove(handle);
        if (removed == null) {
            log.warn("Task {} was already released", handle);
            return false;
        }
        lastStatusChange.set(clock.instant());
        log.debug("Released task {} for job {}", handle, removed.job().getJobId());
        return true;
    }

    /**
     * Returns true while any task is in flight.
     */
    public boolean isBusy() {
        return !tasks.isEmpty();
    }

    /**
     * Returns when a task was last registered or released.
     */
    public Instant lastStatusChange() {
        return lastStatusChange.get();
    }

    /**
     * Returns a snapshot of the in-flight tasks, oldest first.
     */
    public List<InFlightTask> inFlight() {
        return tasks.values().stream()
                .sorted(Comparator.comparingLong(InFlightTask::handle))
                .toList();
    }

    /**
     * A registered task.
     *
     * @param handle       the task handle
     * @param job          the job being run
     * @param registeredAt when the task was registered
     */
    public record InFlightTask(long handle, Job job, Instant registeredAt) {}
}
