package io.nextrun.schedule.eventbridge;

import io.nextrun.schedule.ScheduleTarget;
import software.amazon.awssdk.services.scheduler.model.Target;

/**
 * An EventBridge Scheduler target. Wraps the SDK model so that retry policy,
 * dead-letter config, role and every service-specific parameter survive a rewrite.
 *
 * @param target the target as returned by {@code GetSchedule}
 */
public record EventBridgeScheduleTarget(Target target) implements ScheduleTarget {

    @Override
    public String arn() {
        return target.arn();
    }

    @Override
    public String input() {
        return target.input();
    }

    @Override
    public ScheduleTarget withInput(String input) {
        return new EventBridgeScheduleTarget(target.toBuilder().input(input).build());
    }
}
