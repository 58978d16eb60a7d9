package io.nextrun.schedule.local;

import io.nextrun.schedule.FlexibleTimeWindow;
import io.nextrun.schedule.ScheduleDefinition;
import io.nextrun.schedule.ScheduleExpressions;
import io.nextrun.schedule.ScheduleIdentity;
import io.nextrun.schedule.ScheduleUpdateException;
import io.nextrun.schedule.TargetPayloadCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

/**
 * REST API for creating and inspecting locally stored schedules.
 */
@RestController
@RequestMapping("/api/schedules")
@ConditionalOnProperty(name = "agent.schedule.store", havingValue = "local")
public class LocalScheduleController {

    static final String DEFAULT_TARGET_ARN = "local:runtime/self";

    private final LocalScheduleStore scheduleStore;
    private final TargetPayloadCodec payloadCodec;

    public LocalScheduleController(LocalScheduleStore scheduleStore, TargetPayloadCodec payloadCodec) {
        this.scheduleStore = scheduleStore;
        this.payloadCodec = payloadCodec;
    }

    /**
     * Creates or replaces a schedule.
     */
    @PutMapping("/{group}/{name}")
    public ResponseEntity<ScheduleView> putSchedule(@PathVariable String group, @PathVariable String name,
                                                    @RequestBody PutScheduleRequest request) {
        if (request.scheduleExpression() == null || request.scheduleExpression().isBlank()
                || request.timezone() == null || request.timezone().isBlank()
                || request.payload() == null) {
            return ResponseEntity.badRequest().build();
        }

        String targetArn = request.targetArn() != null && !request.targetArn().isBlank()
                ? request.targetArn() : DEFAULT_TARGET_ARN;
        try {
            ScheduleExpressions.parseAt(request.scheduleExpression(), ScheduleExpressions.zone(request.timezone()));
            LocalScheduleTarget target = new LocalScheduleTarget(targetArn,
                    payloadCodec.wrap(targetArn, request.payload()), Map.of());
            ScheduleDefinition definition = new ScheduleDefinition(
                    new ScheduleIdentity(name, group), null,
                    request.scheduleExpression(), request.timezone(), target, FlexibleTimeWindow.off(),
                    request.description(), request.startDate(), request.endDate(),
                    request.state() != null ? request.state() : ScheduleDefinition.STATE_ENABLED,
                    null, request.actionAfterCompletion());
            scheduleStore.save(definition);
            return ResponseEntity.ok(toView(scheduleStore.get(definition.identity())));
        } catch (ScheduleUpdateException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    /**
     * Returns a stored schedule.
     */
    @GetMapping("/{group}/{name}")
    public ResponseEntity<ScheduleView> getSchedule(@PathVariable String group, @PathVariable String name) {
        try {
            return ResponseEntity.ok(toView(scheduleStore.get(new ScheduleIdentity(name, group))));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        } catch (ScheduleUpdateException e) {
            if (e.getKind() == ScheduleUpdateException.Kind.RESOURCE_NOT_FOUND) {
                return ResponseEntity.notFound().build();
            }
            throw e;
        }
    }

    private ScheduleView toView(ScheduleDefinition definition) {
        Map<String, Object> payload = definition.target() != null
                ? payloadCodec.readPayload(definition.target().input())
                : null;
        return new ScheduleView(
                definition.identity().name(),
                definition.identity().groupName(),
                definition.arn(),
                definition.scheduleExpression(),
                definition.timezone(),
                definition.state(),
                definition.description(),
                definition.startDate(),
                definition.endDate(),
                definition.actionAfterCompletion(),
                payload
        );
    }

    /**
     * Request body for creating a schedule.
     */
    public record PutScheduleRequest(
            String scheduleExpression,
            String timezone,
            Map<String, Object> payload,
            String targetArn,
            String description,
            String state,
            Instant startDate,
            Instant endDate,
            String actionAfterCompletion
    ) {}

    /**
     * A stored schedule with its payload decoded.
     */
    public record ScheduleView(
            String name,
            String groupName,
            String arn,
            String scheduleExpression,
            String timezone,
            String state,
            String description,
            Instant startDate,
            Instant endDate,
            String actionAfterCompletion,
            Map<String, Object> payload
    ) {}
}
