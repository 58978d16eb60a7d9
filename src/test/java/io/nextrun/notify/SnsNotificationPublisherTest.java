package io.nextrun.notify;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SnsNotificationPublisherTest {

    @Test
    void shouldPublishToTopic() {
        SnsClient snsClient = mock(SnsClient.class);
        when(snsClient.publish(any(PublishRequest.class))).thenReturn(PublishResponse.builder().messageId("m-1").build());

        new SnsNotificationPublisher(snsClient).publish("arn:topic", "AgentCore Job SUCCESS: daily", "{}");

        ArgumentCaptor<PublishRequest> captor = ArgumentCaptor.forClass(PublishRequest.class);
        verify(snsClient).publish(captor.capture());
        assertEquals("arn:topic", captor.getValue().topicArn());
        assertEquals("AgentCore Job SUCCESS: daily", captor.getValue().subject());
        assertEquals("{}", captor.getValue().message());
    }

    @Test
    void shouldCutSubjectToSnsLimit() {
        SnsClient snsClient = mock(SnsClient.class);
        when(snsClient.publish(any(PublishRequest.class))).thenReturn(PublishResponse.builder().build());

        new SnsNotificationPublisher(snsClient).publish("arn:topic", "AgentCore Job SUCCESS: " + "j".repeat(200), "{}");

        ArgumentCaptor<PublishRequest> captor = ArgumentCaptor.forClass(PublishRequest.class);
        verify(snsClient).publish(captor.capture());
        assertEquals(100, captor.getValue().subject().length());
    }

    @Test
    void shouldPropagateClientFailure() {
        SnsClient snsClient = mock(SnsClient.class);
        when(snsClient.publish(any(PublishRequest.class))).thenThrow(new IllegalStateException("no credentials"));

        assertThrows(IllegalStateException.class,
                () -> new SnsNotificationPublisher(snsClient).publish("arn:topic", "s", "{}"));
    }
}
