package io.nextrun.schedule.local;

import io.nextrun.job.AgentEntrypoint;
import io.nextrun.job.InvocationRequest;
import io.nextrun.schedule.ScheduleDefinition;
import io.nextrun.schedule.ScheduleIdentity;
import io.nextrun.schedule.ScheduleUpdateException;
import io.nextrun.schedule.TargetPayloadCodec;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Fires a locally stored schedule: decodes the target's nested payload and hands
 * it to the entrypoint, exactly as the managed scheduler would invoke the runtime.
 */
@Component
@ConditionalOnProperty(name = "agent.schedule.store", havingValue = "local")
public class ScheduleTriggerJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduleTriggerJob.class);

    private final LocalScheduleStore scheduleStore;
    private final TargetPayloadCodec payloadCodec;
    private final AgentEntrypoint agentEntrypoint;
    private final Clock clock;

    public ScheduleTriggerJob(LocalScheduleStore scheduleStore, TargetPayloadCodec payloadCodec,
                              AgentEntrypoint agentEntrypoint, Clock clock) {
        this.scheduleStore = scheduleStore;
        this.payloadCodec = payloadCodec;
        this.agentEntrypoint = agentEntrypoint;
        this.clock = clock;
    }

    @Job(name = "Schedule trigger: %0/%1", retries = 0)
    public void fire(String groupName, String scheduleName) {
        ScheduleIdentity identity = new ScheduleIdentity(scheduleName, groupName);

        ScheduleDefinition definition;
        try {
            definition = scheduleStore.get(identity);
        } catch (ScheduleUpdateException e) {
            log.warn("Schedule '{}' could not be loaded, skipping: {}", identity, e.getMessage());
            return;
        }

        if (!definition.isEnabled()) {
            log.info("Schedule '{}' is disabled, skipping", identity);
            return;
        }
        Instant now = clock.instant();
        if ((definition.startDate() != null && now.isBefore(definition.startDate()))
                || (definition.endDate() != null && now.isAfter(definition.endDate()))) {
            log.info("Schedule '{}' fired outside its window [{} - {}], skipping",
                    identity, definition.startDate(), definition.endDate());
            return;
        }
        if (definition.target() == null) {
            log.warn("Schedule '{}' has no target, skipping", identity);
            return;
        }

        Map<String, Object> payload;
        try {
            payload = payloadCodec.readPayload(definition.target().input());
        } catch (ScheduleUpdateException e) {
            log.error("Schedule '{}' carries an unreadable payload: {}", identity, e.getMessage());
            return;
        }

        InvocationRequest request = new InvocationRequest(
                stringValue(payload.get("action")),
                stringValue(payload.get("job_id")),
                stringValue(payload.get(TargetPayloadCodec.INPUT_FIELD)),
                payload.get("seconds") instanceof Number seconds ? seconds.intValue() : null);

        Map<String, Object> response = agentEntrypoint.invoke(request);
        log.info("Schedule '{}' fired: {}", identity, response);
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}
