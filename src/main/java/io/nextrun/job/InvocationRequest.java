package io.nextrun.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request accepted by the entrypoint.
 *
 * @param action  {@code start} to dispatch a job; anything else is a no-op
 * @param jobId   optional job identifier
 * @param input   optional instruction for the reasoning engine
 * @param seconds optional delay before the engine is invoked
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvocationRequest(
        String action,
        @JsonProperty("job_id") String jobId,
        String input,
        Integer seconds
) {
    public static final String ACTION_START = "start";

    public boolean isStart() {
        return ACTION_START.equals(action);
    }
}
