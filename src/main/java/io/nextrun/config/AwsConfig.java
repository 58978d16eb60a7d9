package io.nextrun.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.scheduler.SchedulerClient;
import software.amazon.awssdk.services.sns.SnsClient;

/**
 * AWS clients for EventBridge Scheduler and SNS.
 * Credentials come from the default provider chain.
 */
@Configuration
public class AwsConfig {

    @Value("${aws.region:ap-northeast-1}")
    private String awsRegion;

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "agent.schedule.store", havingValue = "eventbridge", matchIfMissing = true)
    public SchedulerClient schedulerClient() {
        return SchedulerClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.builder().build())
                .build();
    }

    @Bean(destroyMethod = "close")
    public SnsClient snsClient() {
        return SnsClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.builder().build())
                .build();
    }
}
