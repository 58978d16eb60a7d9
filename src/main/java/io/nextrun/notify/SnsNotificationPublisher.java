package io.nextrun.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

/**
 * Publishes notifications to an SNS topic.
 */
@Component
public class SnsNotificationPublisher implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(SnsNotificationPublisher.class);
    static final int MAX_SUBJECT_LENGTH = 100;

    private final SnsClient snsClient;

    public SnsNotificationPublisher(SnsClient snsClient) {
        this.snsClient = snsClient;
    }

    @Override
    public void publish(String topic, String subject, String message) {
        PublishResponse response = snsClient.publish(PublishRequest.builder()
                .topicArn(topic)
                .subject(subject.length() > MAX_SUBJECT_LENGTH ? subject.substring(0, MAX_SUBJECT_LENGTH) : subject)
                .message(message)
                .build());
        log.debug("Published SNS message {} to {}", response.messageId(), topic);
    }
}
