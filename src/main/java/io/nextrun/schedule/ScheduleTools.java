package io.nextrun.schedule;

import io.nextrun.config.AsyncConfig;
import io.nextrun.core.AgentResult;
import io.nextrun.core.ToolRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Registers {@code update_next_schedule} so the agent can decide when it runs
 * next and what it is told then.
 *
 * <p>The tool never throws: every failure comes back as a descriptive string so
 * the agent loop can carry on. Store calls run on the schedule-store executor.</p>
 */
@Component
public class ScheduleTools {

    private static final Logger log = LoggerFactory.getLogger(ScheduleTools.class);
    static final String DEFAULT_TIMEZONE = "Asia/Tokyo";
    private static final int NEXT_INPUT_PREVIEW_LENGTH = 100;

    private final ToolRegistry toolRegistry;
    private final ScheduleMutator scheduleMutator;
    private final Clock clock;
    private final ExecutorService scheduleStoreExecutor;

    public ScheduleTools(ToolRegistry toolRegistry, ScheduleMutator scheduleMutator, Clock clock,
                         @Qualifier(AsyncConfig.SCHEDULE_STORE_EXECUTOR) ExecutorService scheduleStoreExecutor) {
        this.toolRegistry = toolRegistry;
        this.scheduleMutator = scheduleMutator;
        this.clock = clock;
        this.scheduleStoreExecutor = scheduleStoreExecutor;
    }

    @PostConstruct
    public void registerTools() {
        toolRegistry.registerAgentTool("update_next_schedule",
                "Update this agent's schedule: set when it should run next and what instruction it receives then. "
                        + "Use it to tell your future self what to do next time.",
                """
                {"type":"object","properties":{"next_execution":{"type":"string","description":"Next execution time: ISO-8601 datetime (e.g. 2025-12-27T10:30:00) or relative time like +30m, +2h, +1d"},"next_input":{"type":"string","description":"Instruction for the next execution (optional, keeps the current one when omitted)"},"timezone":{"type":"string","description":"IANA timezone for the schedule expression (default: Asia/Tokyo)"}},"required":["next_execution"]}""",
                this::updateNextScheduleTool);
        log.info("Registered schedule tool");
    }

    private AgentResult updateNextScheduleTool(Map<String, Object> args) {
        String nextExecution = firstString(args, "next_execution", "execute_at", "when");
        String nextInput = firstString(args, "next_input", "input", "message");
        String timezone = firstString(args, "timezone", "tz");
        return AgentResult.of(updateNextSchedule(nextExecution, nextInput, timezone));
    }

    /**
     * Reschedules the agent and describes the outcome.
     *
     * @param nextExecution relative time or ISO-8601 timestamp
     * @param nextInput     instruction for the next run, or null to keep the current one
     * @param timezone      IANA zone, {@value #DEFAULT_TIMEZONE} when blank
     * @return a confirmation, or a message starting with {@code Error:} / {@code Failed to update schedule:}
     */
    public String updateNextSchedule(String nextExecution, String nextInput, String timezone) {
        String zone = (timezone == null || timezone.isBlank()) ? DEFAULT_TIMEZONE : timezone;
        Instant now = clock.instant();
        try {
            ScheduleUpdateResult result = CompletableFuture
                    .supplyAsync(() -> scheduleMutator.reschedule(now, nextExecution, nextInput, zone),
                            scheduleStoreExecutor)
                    .get();
            return describe(result);
        } catch (ExecutionException e) {
            return describeFailure(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Failed to update schedule: interrupted";
        } catch (RejectedExecutionException e) {
            return describeFailure(e);
        }
    }

    static String describe(ScheduleUpdateResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("Schedule updated successfully!");
        lines.add("- Schedule: %s (group: %s)".formatted(result.scheduleName(), result.groupName()));
        lines.add("- Next execution: " + result.newExpression());
        lines.add("- Timezone: " + result.timezone());
        String nextInput = result.nextInput();
        if (nextInput != null && !nextInput.isEmpty()) {
            lines.add("- Next input: " + (nextInput.length() > NEXT_INPUT_PREVIEW_LENGTH
                    ? nextInput.substring(0, NEXT_INPUT_PREVIEW_LENGTH) + "..."
                    : nextInput));
        }
        lines.add("- ARN: " + result.scheduleArn());
        return String.join("\n", lines);
    }

    private static String describeFailure(Throwable error) {
        if (error instanceof ScheduleUpdateException e
                && e.getKind() == ScheduleUpdateException.Kind.PAST_OR_PRESENT_TIME) {
            log.warn("Rejected reschedule: {}", e.getMessage());
            return "Error: " + e.getMessage();
        }
        log.error("Failed to update schedule: {}", error.getMessage(), error);
        return "Failed to update schedule: " + error.getMessage();
    }

    /**
     * Returns the first non-null value found for any of the given keys, as a string.
     */
    private static String firstString(Map<String, Object> args, String... keys) {
        for (String key : keys) {
            Object val = args.get(key);
            if (val != null) return val.toString();
        }
        return null;
    }
}
