package io.nextrun.notify;

/**
 * Pub/sub endpoint that job notifications are published to.
 */
public interface NotificationPublisher {

    /**
     * Publishes one message. May block for the duration of the call and may throw.
     */
    void publish(String topic, String subject, String message);
}
