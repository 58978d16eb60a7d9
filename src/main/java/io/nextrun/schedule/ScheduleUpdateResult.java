package io.nextrun.schedule;

/**
 * Outcome of a successful reschedule.
 *
 * @param scheduleArn   ARN returned by the store
 * @param newExpression the expression that was written
 * @param timezone      the timezone that was written
 * @param scheduleName  schedule name
 * @param groupName     schedule group
 * @param nextInput     the input for the next run, or null if it was left unchanged
 */
public record ScheduleUpdateResult(
        String scheduleArn,
        String newExpression,
        String timezone,
        String scheduleName,
        String groupName,
        String nextInput
) {}
