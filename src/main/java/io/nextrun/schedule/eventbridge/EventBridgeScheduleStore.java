package io.nextrun.schedule.eventbridge;

import io.nextrun.schedule.FlexibleTimeWindow;
import io.nextrun.schedule.ScheduleDefinition;
import io.nextrun.schedule.ScheduleIdentity;
import io.nextrun.schedule.ScheduleStore;
import io.nextrun.schedule.ScheduleTarget;
import io.nextrun.schedule.ScheduleUpdateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.scheduler.SchedulerClient;
import software.amazon.awssdk.services.scheduler.model.GetScheduleRequest;
import software.amazon.awssdk.services.scheduler.model.GetScheduleResponse;
import software.amazon.awssdk.services.scheduler.model.ResourceNotFoundException;
import software.amazon.awssdk.services.scheduler.model.Target;
import software.amazon.awssdk.services.scheduler.model.UpdateScheduleRequest;
import software.amazon.awssdk.services.scheduler.model.UpdateScheduleResponse;

/**
 * Schedule store backed by Amazon EventBridge Scheduler.
 *
 * <p>{@code UpdateSchedule} replaces the whole schedule, so every optional field
 * read by {@code GetSchedule} is sent back as read. Leaving one out would reset it.</p>
 */
@Component
@ConditionalOnProperty(name = "agent.schedule.store", havingValue = "eventbridge", matchIfMissing = true)
public class EventBridgeScheduleStore implements ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(EventBridgeScheduleStore.class);

    private final SchedulerClient schedulerClient;

    public EventBridgeScheduleStore(SchedulerClient schedulerClient) {
        this.schedulerClient = schedulerClient;
    }

    @Override
    public ScheduleDefinition get(ScheduleIdentity identity) {
        GetScheduleResponse response;
        try {
            response = schedulerClient.getSchedule(GetScheduleRequest.builder()
                    .name(identity.name())
                    .groupName(identity.groupName())
                    .build());
        } catch (ResourceNotFoundException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.RESOURCE_NOT_FOUND,
                    "Schedule not found: " + identity, e);
        } catch (SdkException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.STORE_UNAVAILABLE,
                    "Failed to read schedule " + identity + ": " + e.getMessage(), e);
        }

        return new ScheduleDefinition(
                identity,
                response.arn(),
                response.scheduleExpression(),
                response.scheduleExpressionTimezone(),
                response.target() != null ? new EventBridgeScheduleTarget(response.target()) : null,
                toWindow(response.flexibleTimeWindow()),
                response.description(),
                response.startDate(),
                response.endDate(),
                response.stateAsString(),
                response.kmsKeyArn(),
                response.actionAfterCompletionAsString()
        );
    }

    @Override
    public String update(ScheduleDefinition definition) {
        ScheduleIdentity identity = definition.identity();
        UpdateScheduleRequest.Builder request = UpdateScheduleRequest.builder()
                .name(identity.name())
                .groupName(identity.groupName())
                .scheduleExpression(definition.scheduleExpression())
                .scheduleExpressionTimezone(definition.timezone())
                .flexibleTimeWindow(toSdkWindow(definition.flexibleTimeWindow()))
                .target(toSdkTarget(definition.target()));

        if (definition.description() != null) request.description(definition.description());
        if (definition.startDate() != null) request.startDate(definition.startDate());
        if (definition.endDate() != null) request.endDate(definition.endDate());
        if (definition.state() != null) request.state(definition.state());
        if (definition.kmsKeyArn() != null) request.kmsKeyArn(definition.kmsKeyArn());
        if (definition.actionAfterCompletion() != null) request.actionAfterCompletion(definition.actionAfterCompletion());

        try {
            UpdateScheduleResponse response = schedulerClient.updateSchedule(request.build());
            log.debug("Updated EventBridge schedule {}", response.scheduleArn());
            return response.scheduleArn();
        } catch (ResourceNotFoundException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.RESOURCE_NOT_FOUND,
                    "Schedule not found: " + identity, e);
        } catch (SdkException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.STORE_UNAVAILABLE,
                    "Failed to update schedule " + identity + ": " + e.getMessage(), e);
        }
    }

    private static FlexibleTimeWindow toWindow(software.amazon.awssdk.services.scheduler.model.FlexibleTimeWindow window) {
        if (window == null) {
            return null;
        }
        return new FlexibleTimeWindow(window.modeAsString(), window.maximumWindowInMinutes());
    }

    private static software.amazon.awssdk.services.scheduler.model.FlexibleTimeWindow toSdkWindow(FlexibleTimeWindow window) {
        FlexibleTimeWindow source = window != null ? window : FlexibleTimeWindow.off();
        return software.amazon.awssdk.services.scheduler.model.FlexibleTimeWindow.builder()
                .mode(source.mode())
                .maximumWindowInMinutes(source.maximumWindowInMinutes())
                .build();
    }

    private static Target toSdkTarget(ScheduleTarget target) {
        if (target instanceof EventBridgeScheduleTarget eventBridgeTarget) {
            return eventBridgeTarget.target();
        }
        if (target == null) {
            return null;
        }
        return Target.builder().arn(target.arn()).input(target.input()).build();
    }
}
