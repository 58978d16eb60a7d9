package io.nextrun.schedule;

/**
 * Identifies one persisted schedule.
 *
 * @param name      the schedule name
 * @param groupName the schedule group
 */
public record ScheduleIdentity(String name, String groupName) {

    @Override
    public String toString() {
        return groupName + "/" + name;
    }
}
