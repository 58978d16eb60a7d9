package io.nextrun.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.nextrun.security.InputSanitizer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the runtime: the invocation entrypoint, the health ping and a
 * view of in-flight tasks.
 */
@RestController
public class InvocationController {

    private final AgentEntrypoint agentEntrypoint;
    private final TaskRegistry taskRegistry;
    private final InputSanitizer inputSanitizer;

    public InvocationController(AgentEntrypoint agentEntrypoint, TaskRegistry taskRegistry,
                                InputSanitizer inputSanitizer) {
        this.agentEntrypoint = agentEntrypoint;
        this.taskRegistry = taskRegistry;
        this.inputSanitizer = inputSanitizer;
    }

    /**
     * Accepts an invocation and answers before any work is done.
     */
    @PostMapping("/invocations")
    public ResponseEntity<Map<String, Object>> invoke(@RequestBody InvocationRequest request) {
        String input = request.input() != null ? inputSanitizer.sanitize(request.input()) : null;
        return ResponseEntity.ok(agentEntrypoint.invoke(
                new InvocationRequest(request.action(), request.jobId(), input, request.seconds())));
    }

    /**
     * Reports {@code HealthyBusy} while background tasks are running, {@code Healthy} otherwise.
     */
    @GetMapping("/ping")
    public Map<String, Object> ping() {
        return Map.of(
                "status", taskRegistry.isBusy() ? "HealthyBusy" : "Healthy",
                "time_of_last_update", taskRegistry.lastStatusChange().getEpochSecond()
        );
    }

    /**
     * Lists in-flight tasks.
     */
    @GetMapping("/api/tasks")
    public List<TaskView> tasks() {
        return taskRegistry.inFlight().stream()
                .map(t -> new TaskView(t.handle(), t.job().getJobId(), t.job().getStatus().name(),
                        t.registeredAt().toString()))
                .toList();
    }

    /**
     * One in-flight task as shown by {@code GET /api/tasks}.
     */
    public record TaskView(
            @JsonProperty("task_id") long taskId,
            @JsonProperty("job_id") String jobId,
            String status,
            @JsonProperty("registered_at") String registeredAt
    ) {}
}
