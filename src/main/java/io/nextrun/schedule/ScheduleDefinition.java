package io.nextrun.schedule;

import java.time.Instant;

/**
 * A persisted schedule: when it runs next and what it delivers.
 *
 * <p>Definitions are read, copied with {@link #withSchedule} and {@link #withTarget},
 * and written back. The copy methods change only the fields they name.</p>
 *
 * @param identity              schedule name and group
 * @param arn                   the schedule's ARN as reported by the store
 * @param scheduleExpression    absolute expression, e.g. {@code at(2025-01-01T00:05:00)}
 * @param timezone              IANA zone the expression is interpreted in
 * @param target                what the schedule invokes
 * @param flexibleTimeWindow    firing window
 * @param description           optional description
 * @param startDate             optional start of the validity window
 * @param endDate               optional end of the validity window
 * @param state                 {@code ENABLED} or {@code DISABLED}, null if unset
 * @param kmsKeyArn             optional customer managed key
 * @param actionAfterCompletion optional action once a one-time schedule has fired
 */
public record ScheduleDefinition(
        ScheduleIdentity identity,
        String arn,
        String scheduleExpression,
        String timezone,
        ScheduleTarget target,
        FlexibleTimeWindow flexibleTimeWindow,
        String description,
        Instant startDate,
        Instant endDate,
        String state,
        String kmsKeyArn,
        String actionAfterCompletion
) {
    public static final String STATE_ENABLED = "ENABLED";
    public static final String STATE_DISABLED = "DISABLED";

    public ScheduleDefinition withSchedule(String scheduleExpression, String timezone) {
        return new ScheduleDefinition(identity, arn, scheduleExpression, timezone, target, flexibleTimeWindow,
                description, startDate, endDate, state, kmsKeyArn, actionAfterCompletion);
    }

    public ScheduleDefinition withTarget(ScheduleTarget target) {
        return new ScheduleDefinition(identity, arn, scheduleExpression, timezone, target, flexibleTimeWindow,
                description, startDate, endDate, state, kmsKeyArn, actionAfterCompletion);
    }

    /**
     * Returns true unless the schedule is explicitly disabled.
     */
    public boolean isEnabled() {
        return state == null || STATE_ENABLED.equalsIgnoreCase(state);
    }
}
