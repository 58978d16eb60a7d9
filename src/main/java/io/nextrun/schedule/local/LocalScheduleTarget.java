package io.nextrun.schedule.local;

import io.nextrun.schedule.ScheduleTarget;

import java.util.Map;

/**
 * Target of a locally stored schedule.
 *
 * @param arn        identifier of the invoked runtime
 * @param input      serialized envelope carrying the nested payload
 * @param attributes any further target settings, stored and returned untouched
 */
public record LocalScheduleTarget(String arn, String input, Map<String, Object> attributes) implements ScheduleTarget {

    public LocalScheduleTarget {
        if (attributes == null) {
            attributes = Map.of();
        }
    }

    @Override
    public ScheduleTarget withInput(String input) {
        return new LocalScheduleTarget(arn, input, attributes);
    }
}
