package io.nextrun.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Sends job completion notifications.
 *
 * <p>{@link #notify} never throws: a missing topic is a logged no-op and any
 * publish failure is logged and dropped, so a messaging outage cannot change a
 * job's outcome.</p>
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
    static final int MAX_RESULT_LENGTH = 1000;
    static final String TRUNCATION_SUFFIX = "...(truncated)";

    private final NotificationPublisher publisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String topicArn;

    public NotificationDispatcher(NotificationPublisher publisher, ObjectMapper objectMapper, Clock clock,
                                  @Value("${agent.notification.topic-arn:}") String topicArn) {
        this.publisher = publisher;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
        this.topicArn = topicArn;
    }

    /**
     * Publishes a job notification.
     *
     * @param jobId   the job identifier
     * @param status  the job outcome
     * @param message human-readable summary
     * @param result  the job result, or null; truncated to {@value #MAX_RESULT_LENGTH} characters
     */
    public void notify(String jobId, NotificationStatus status, String message, Object result) {
        if (topicArn == null || topicArn.isBlank()) {
            log.warn("Notification topic is not configured, skipping notification for job {}", jobId);
            return;
        }

        try {
            var record = new NotificationRecord(jobId, status.value(), message,
                    clock.instant().toString(), truncate(result));
            String subject = "AgentCore Job %s: %s".formatted(status.value().toUpperCase(), jobId);
            publisher.publish(topicArn, subject, objectMapper.writeValueAsString(record));
            log.info("Notification sent: job={}, status={}", jobId, status.value());
        } catch (Exception e) {
            log.error("Failed to send notification for job {}: {}", jobId, e.getMessage(), e);
        }
    }

    static String truncate(Object result) {
        if (result == null) {
            return null;
        }
        String text = String.valueOf(result);
        if (text.isEmpty()) {
            return null;
        }
        return text.length() > MAX_RESULT_LENGTH
                ? text.substring(0, MAX_RESULT_LENGTH) + TRUNCATION_SUFFIX
                : text;
    }
}
