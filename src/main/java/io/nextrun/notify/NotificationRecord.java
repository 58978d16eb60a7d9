package io.nextrun.notify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Body of a job notification. Built per publish, never stored.
 *
 * @param jobId     the job identifier
 * @param status    {@code success} or {@code error}
 * @param message   human-readable summary
 * @param timestamp ISO-8601 instant the notification was built
 * @param result    the job's result, already truncated; omitted when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"job_id", "status", "message", "timestamp", "result"})
public record NotificationRecord(
        @JsonProperty("job_id") String jobId,
        String status,
        String message,
        String timestamp,
        String result
) {}
