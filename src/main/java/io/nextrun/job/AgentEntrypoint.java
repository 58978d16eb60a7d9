package io.nextrun.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only synchronous contract: accept a request and answer at once.
 *
 * <p>A {@code start} request is turned into a {@link Job} and dispatched; the
 * caller receives {@code {status: started, task_id}} and never sees the job's
 * outcome, which is reported through notifications. Any other action answers
 * {@code {status: noop}}.</p>
 */
@Component
public class AgentEntrypoint {

    private static final Logger log = LoggerFactory.getLogger(AgentEntrypoint.class);

    private final TaskOrchestrator taskOrchestrator;
    private final String defaultJobId;
    private final String defaultInput;

    public AgentEntrypoint(TaskOrchestrator taskOrchestrator,
                           @Value("${agent.jobs.default-job-id:mvp}") String defaultJobId,
                           @Value("${agent.jobs.default-input:Say hello and show current_time.}") String defaultInput) {
        this.taskOrchestrator = taskOrchestrator;
        this.defaultJobId = defaultJobId;
        this.defaultInput = defaultInput;
    }

    public Map<String, Object> invoke(InvocationRequest request) {
        if (request == null || !request.isStart()) {
            log.debug("Ignoring invocation with action '{}'", request != null ? request.action() : null);
            return Map.of("status", "noop");
        }

        String jobId = isBlank(request.jobId()) ? defaultJobId : request.jobId();
        String input = isBlank(request.input()) ? defaultInput : request.input();
        int seconds = request.seconds() != null ? Math.max(0, request.seconds()) : 0;

        long handle = taskOrchestrator.start(new Job(jobId, input, seconds));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "started");
        response.put("task_id", handle);
        return response;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
