package io.nextrun.job;

import io.nextrun.config.AsyncConfig;
import io.nextrun.core.ReasoningEngine;
import io.nextrun.notify.NotificationDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class TaskOrchestratorTest {

    private TaskRegistry taskRegistry;
    private ExecutorService executor;
    private CountDownLatch engineEntered;
    private CountDownLatch releaseEngine;
    private TaskOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        taskRegistry = new TaskRegistry(Clock.systemUTC());
        executor = Executors.newFixedThreadPool(2);
        engineEntered = new CountDownLatch(1);
        releaseEngine = new CountDownLatch(1);
        ReasoningEngine blockingEngine = input -> {
            engineEntered.countDown();
            try {
                releaseEngine.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "done: " + input;
        };
        var jobRunner = new JobRunner(blockingEngine, mock(NotificationDispatcher.class), taskRegistry, executor);
        orchestrator = new TaskOrchestrator(taskRegistry, jobRunner);
    }

    @AfterEach
    void tearDown() {
        releaseEngine.countDown();
        executor.shutdownNow();
    }

    @Test
    void shouldReturnHandleWhileEngineIsStillRunning() throws Exception {
        long handle = orchestrator.start(new Job("daily", "work", 0));

        assertTrue(engineEntered.await(5, TimeUnit.SECONDS));
        assertTrue(isInFlight(handle));
        assertTrue(taskRegistry.isBusy());

        releaseEngine.countDown();
        waitUntilIdle();
        assertFalse(isInFlight(handle));
    }

    @Test
    void shouldIssueDistinctHandles() {
        long first = orchestrator.start(new Job("a", "work", 0));
        long second = orchestrator.start(new Job("b", "work", 0));

        assertNotEquals(first, second);
    }

    @Test
    void shouldReleaseSlotWhenLaunchIsRejected() {
        executor.shutdownNow();

        assertThrows(RejectedExecutionException.class, () -> orchestrator.start(new Job("daily", "work", 0)));
        assertFalse(taskRegistry.isBusy());
    }

    @Test
    void shouldTolerateReleaseOfUnknownHandle() {
        assertDoesNotThrow(() -> orchestrator.release(999L));
    }

    @Test
    void shouldRunEveryJobConcurrentlyOnJobExecutor() throws Exception {
        int jobs = 12;
        ExecutorService jobExecutor = new AsyncConfig().jobExecutor();
        var entered = new CountDownLatch(jobs);
        var release = new CountDownLatch(1);
        ReasoningEngine slowEngine = input -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "done";
        };
        var registry = new TaskRegistry(Clock.systemUTC());
        var concurrent = new TaskOrchestrator(registry,
                new JobRunner(slowEngine, mock(NotificationDispatcher.class), registry, jobExecutor));
        try {
            for (int i = 0; i < jobs; i++) {
                concurrent.start(new Job("job-" + i, "work", 0));
            }

            assertTrue(entered.await(5, TimeUnit.SECONDS), "every job should reach the engine while the others block");
            assertTrue(registry.inFlight().stream().allMatch(t -> t.job().getStatus() == JobStatus.RUNNING));
        } finally {
            release.countDown();
            jobExecutor.shutdownNow();
        }
    }

    private boolean isInFlight(long handle) {
        return taskRegistry.inFlight().stream().anyMatch(t -> t.handle() == handle);
    }

    private void waitUntilIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (taskRegistry.isBusy() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }
}
