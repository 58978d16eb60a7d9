package io.nextrun.schedule;

/**
 * What a schedule invokes when it fires.
 *
 * <p>Only the serialized {@code input} is understood by this service; every other
 * setting of the target is carried by the implementation and passed through untouched.</p>
 */
public interface ScheduleTarget {

    /**
     * Returns the ARN (or local identifier) of the invoked resource.
     */
    String arn();

    /**
     * Returns the serialized input delivered to the target, or null if none is set.
     */
    String input();

    /**
     * Returns a copy of this target with a different input and every other setting unchanged.
     */
    ScheduleTarget withInput(String input);
}
