package io.nextrun.schedule;

/**
 * Persistent store of schedule definitions.
 *
 * <p>Implementations report a missing schedule with
 * {@link ScheduleUpdateException.Kind#RESOURCE_NOT_FOUND} and I/O failures with
 * {@link ScheduleUpdateException.Kind#STORE_UNAVAILABLE}. Calls may block.</p>
 */
public interface ScheduleStore {

    /**
     * Reads the current definition of a schedule.
     */
    ScheduleDefinition get(ScheduleIdentity identity);

    /**
     * Replaces a schedule with the given definition.
     *
     * @return the schedule's ARN
     */
    String update(ScheduleDefinition definition);
}
