package io.nextrun.schedule.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nextrun.schedule.FlexibleTimeWindow;
import io.nextrun.schedule.ScheduleDefinition;
import io.nextrun.schedule.ScheduleExpressions;
import io.nextrun.schedule.ScheduleIdentity;
import io.nextrun.schedule.ScheduleStore;
import io.nextrun.schedule.ScheduleTarget;
import io.nextrun.schedule.ScheduleUpdateException;
import org.jobrunr.jobs.JobId;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Schedule store that keeps definitions as JSON files and fires them with JobRunr.
 *
 * <p>Each schedule lives at {@code {path}/{group}/{name}.json}. Every write
 * replaces the schedule's one-shot JobRunr trigger: the previous trigger job is
 * deleted and, if the schedule is enabled and its {@code at(...)} instant is in
 * the future, a new {@link ScheduleTriggerJob#fire} is scheduled for that instant.</p>
 */
@Component
@ConditionalOnProperty(name = "agent.schedule.store", havingValue = "local")
public class LocalScheduleStore implements ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(LocalScheduleStore.class);
    private static final Pattern SAFE_NAME = Pattern.compile("[0-9A-Za-z_-][0-9A-Za-z._-]{0,63}");
    static final String ARN_PREFIX = "local:schedule/";

    private final ObjectMapper objectMapper;
    private final JobScheduler jobScheduler;
    private final Clock clock;
    private final Path schedulesDir;

    public LocalScheduleStore(ObjectMapper objectMapper, JobScheduler jobScheduler, Clock clock,
                              @Value("${agent.schedule.local.path:./data/schedules}") String schedulesPath) {
        this.objectMapper = objectMapper;
        this.jobScheduler = jobScheduler;
        this.clock = clock;
        this.schedulesDir = Path.of(schedulesPath);
    }

    @Override
    public ScheduleDefinition get(ScheduleIdentity identity) {
        return read(identity).toDefinition();
    }

    @Override
    public synchronized String update(ScheduleDefinition definition) {
        StoredSchedule previous = read(definition.identity());
        return write(definition, previous.triggerJobId());
    }

    /**
     * Creates a schedule or replaces an existing one.
     *
     * @return the schedule's ARN
     */
    public synchronized String save(ScheduleDefinition definition) {
        Path file = fileFor(definition.identity());
        String previousTrigger = null;
        if (Files.exists(file)) {
            previousTrigger = read(definition.identity()).triggerJobId();
        }
        return write(definition, previousTrigger);
    }

    // The previous trigger is cancelled only once the new file is on disk; a failed
    // write cancels the new trigger instead and leaves the stored schedule as it was.
    private String write(ScheduleDefinition definition, String previousTriggerJobId) {
        ScheduleIdentity identity = definition.identity();
        Path file = fileFor(identity);
        String triggerJobId = armTrigger(definition);

        String arn = ARN_PREFIX + identity.groupName() + "/" + identity.name();
        StoredSchedule stored = StoredSchedule.from(definition, arn, triggerJobId);
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), stored);
        } catch (IOException e) {
            cancelTrigger(identity, triggerJobId);
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.STORE_UNAVAILABLE,
                    "Failed to write schedule " + identity + ": " + e.getMessage(), e);
        }
        cancelTrigger(identity, previousTriggerJobId);
        log.info("Saved local schedule '{}' ({} {})", identity, definition.scheduleExpression(), definition.timezone());
        return arn;
    }

    private String armTrigger(ScheduleDefinition definition) {
        if (!definition.isEnabled()) {
            log.info("Schedule '{}' is disabled, no trigger armed", definition.identity());
            return null;
        }
        Instant fireAt = ScheduleExpressions.parseAt(definition.scheduleExpression(),
                ScheduleExpressions.zone(definition.timezone()));
        if (!fireAt.isAfter(clock.instant())) {
            log.warn("Schedule '{}' is set to {} which has already passed, no trigger armed",
                    definition.identity(), definition.scheduleExpression());
            return null;
        }

        String groupName = definition.identity().groupName();
        String scheduleName = definition.identity().name();
        JobId jobId = jobScheduler.<ScheduleTriggerJob>schedule(fireAt, job -> job.fire(groupName, scheduleName));
        log.debug("Armed trigger {} for '{}' at {}", jobId, definition.identity(), fireAt);
        return jobId.toString();
    }

    private void cancelTrigger(ScheduleIdentity identity, String triggerJobId) {
        if (triggerJobId == null) {
            return;
        }
        try {
            jobScheduler.delete(UUID.fromString(triggerJobId));
            log.debug("Cancelled trigger {} of '{}'", triggerJobId, identity);
        } catch (Exception e) {
            log.debug("Could not cancel trigger {} of '{}': {}", triggerJobId, identity, e.getMessage());
        }
    }

    private StoredSchedule read(ScheduleIdentity identity) {
        Path file = fileFor(identity);
        if (!Files.exists(file)) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.RESOURCE_NOT_FOUND,
                    "Schedule not found: " + identity);
        }
        try {
            return objectMapper.readValue(file.toFile(), StoredSchedule.class);
        } catch (IOException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.STORE_UNAVAILABLE,
                    "Failed to read schedule " + identity + ": " + e.getMessage(), e);
        }
    }

    private Path fileFor(ScheduleIdentity identity) {
        if (!SAFE_NAME.matcher(identity.name()).matches() || !SAFE_NAME.matcher(identity.groupName()).matches()) {
            throw new IllegalArgumentException("Invalid schedule identity: " + identity);
        }
        return schedulesDir.resolve(identity.groupName()).resolve(identity.name() + ".json");
    }

    /**
     * On-disk form of a schedule.
     */
    record StoredSchedule(
            String name,
            String groupName,
            String arn,
            String scheduleExpression,
            String timezone,
            LocalScheduleTarget target,
            FlexibleTimeWindow flexibleTimeWindow,
            String description,
            Instant startDate,
            Instant endDate,
            String state,
            String kmsKeyArn,
            String actionAfterCompletion,
            String triggerJobId
    ) {
        static StoredSchedule from(ScheduleDefinition definition, String arn, String triggerJobId) {
            return new StoredSchedule(
                    definition.identity().name(),
                    definition.identity().groupName(),
                    arn,
                    definition.scheduleExpression(),
                    definition.timezone(),
                    toLocalTarget(definition.target()),
                    definition.flexibleTimeWindow(),
                    definition.description(),
                    definition.startDate(),
                    definition.endDate(),
                    definition.state(),
                    definition.kmsKeyArn(),
                    definition.actionAfterCompletion(),
                    triggerJobId
            );
        }

        ScheduleDefinition toDefinition() {
            return new ScheduleDefinition(new ScheduleIdentity(name, groupName), arn, scheduleExpression, timezone,
                    target, flexibleTimeWindow, description, startDate, endDate, state, kmsKeyArn,
                    actionAfterCompletion);
        }

        private static LocalScheduleTarget toLocalTarget(ScheduleTarget target) {
            if (target == null || target instanceof LocalScheduleTarget) {
                return (LocalScheduleTarget) target;
            }
            return new LocalScheduleTarget(target.arn(), target.input(), Map.of());
        }
    }
}
