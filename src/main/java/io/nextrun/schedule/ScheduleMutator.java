package io.nextrun.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Moves the agent's own schedule to its next run.
 *
 * <p>Reads the configured schedule, replaces its expression with a one-time
 * {@code at(...)} expression, optionally rewrites the nested {@code input} of the
 * target payload, and writes the definition back with every other field as read.</p>
 *
 * <p>The read and the write are not atomic. Two mutators targeting the same
 * schedule race and the last write wins; only one chain of self-rescheduling jobs
 * is expected per schedule.</p>
 */
@Component
public class ScheduleMutator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleMutator.class);
    static final String DEFAULT_GROUP = "default";

    private final ScheduleStore scheduleStore;
    private final TargetPayloadCodec payloadCodec;
    private final String scheduleName;
    private final String groupName;

    public ScheduleMutator(ScheduleStore scheduleStore, TargetPayloadCodec payloadCodec,
                           @Value("${agent.schedule.name:}") String scheduleName,
                           @Value("${agent.schedule.group:default}") String groupName) {
        this.scheduleStore = scheduleStore;
        this.payloadCodec = payloadCodec;
        this.scheduleName = scheduleName;
        this.groupName = (groupName == null || groupName.isBlank()) ? DEFAULT_GROUP : groupName;
    }

    /**
     * Reschedules the configured schedule.
     *
     * @param now           the current instant
     * @param nextExecution relative time ({@code +30m}) or ISO-8601 timestamp
     * @param nextInput     instruction for the next run, or null to keep the current one
     * @param timezone      IANA zone for the expression and for timestamps without zone information
     * @return what was written
     * @throws ScheduleUpdateException if the time is invalid or not in the future, or the store fails
     */
    public ScheduleUpdateResult reschedule(Instant now, String nextExecution, String nextInput, String timezone) {
        ZoneId zone = ScheduleExpressions.zone(timezone);
        Instant next = resolve(now, nextExecution, zone);

        if (!next.isAfter(now)) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.PAST_OR_PRESENT_TIME,
                    "Next execution time must be in the future. Provided: %s, Current: %s".formatted(
                            next.atZone(zone).toOffsetDateTime(), now.atZone(zone).toOffsetDateTime()));
        }

        String expression = ScheduleExpressions.at(next, zone);
        ScheduleIdentity identity = identity();
        ScheduleDefinition existing = scheduleStore.get(identity);

        ScheduleTarget target = existing.target();
        if (nextInput != null) {
            if (target == null) {
                throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_PAYLOAD,
                        "Schedule " + identity + " has no target to carry the next input");
            }
            target = target.withInput(payloadCodec.replaceInput(target.input(), nextInput));
        }

        String arn = scheduleStore.update(existing.withSchedule(expression, timezone).withTarget(target));
        log.info("Rescheduled '{}' to {} ({})", identity, expression, timezone);

        return new ScheduleUpdateResult(arn, expression, timezone, identity.name(), identity.groupName(), nextInput);
    }

    /**
     * Returns the configured schedule identity.
     *
     * @throws ScheduleUpdateException with kind CONFIGURATION_MISSING if no schedule name is configured
     */
    public ScheduleIdentity identity() {
        if (scheduleName == null || scheduleName.isBlank()) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.CONFIGURATION_MISSING,
                    "Schedule name is not configured (agent.schedule.name / SCHEDULE_NAME)");
        }
        return new ScheduleIdentity(scheduleName, groupName);
    }

    static Instant resolve(Instant now, String nextExecution, ZoneId zone) {
        if (nextExecution == null || nextExecution.isBlank()) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                    "Next execution time is required");
        }
        String text = nextExecution.strip();
        if (text.startsWith("+")) {
            try {
                return now.plus(RelativeTimeParser.parse(text));
            } catch (DateTimeException | ArithmeticException e) {
                throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                        "Relative time out of range: " + text, e);
            }
        }
        return parseTimestamp(text, zone);
    }

    private static Instant parseTimestamp(String text, ZoneId zone) {
        String iso = (text.length() > 10 && text.charAt(10) == ' ')
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(iso, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(iso).atStartOfDay(zone).toInstant();
            } catch (DateTimeParseException ignored) {
                throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                        "Invalid next execution time: %s. Use ISO-8601 (2025-12-27T10:30:00) or '+30m', '+2h', '+1d'"
                                .formatted(text), e);
            }
        }
    }
}
