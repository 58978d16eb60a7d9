package io.nextrun.schedule.local;

import io.nextrun.schedule.ScheduleDefinition;
import io.nextrun.schedule.ScheduleIdentity;
import io.nextrun.schedule.ScheduleUpdateException;
import io.nextrun.schedule.TargetPayloadCodec;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LocalScheduleController.class)
@Import(TargetPayloadCodec.class)
@TestPropertySource(properties = "agent.schedule.store=local")
class LocalScheduleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TargetPayloadCodec codec;

    @MockBean
    private LocalScheduleStore scheduleStore;

    @Test
    void shouldCreateScheduleWithWrappedPayload() throws Exception {
        AtomicReference<ScheduleDefinition> stored = new AtomicReference<>();
        when(scheduleStore.save(any())).thenAnswer(invocation -> {
            stored.set(invocation.getArgument(0));
            return "local:schedule/agents/agent-loop";
        });
        when(scheduleStore.get(new ScheduleIdentity("agent-loop", "agents")))
                .thenAnswer(invocation -> stored.get());

        mockMvc.perform(put("/api/schedules/agents/agent-loop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "scheduleExpression": "at(2025-01-01T00:05:00)",
                                    "timezone": "Asia/Tokyo",
                                    "payload": {"action": "start", "input": "Execution #1"}
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("agent-loop"))
                .andExpect(jsonPath("$.groupName").value("agents"))
                .andExpect(jsonPath("$.state").value("ENABLED"))
                .andExpect(jsonPath("$.payload.input").value("Execution #1"));

        ArgumentCaptor<ScheduleDefinition> captor = ArgumentCaptor.forClass(ScheduleDefinition.class);
        verify(scheduleStore).save(captor.capture());
        ScheduleDefinition saved = captor.getValue();
        assertEquals("at(2025-01-01T00:05:00)", saved.scheduleExpression());
        assertEquals(LocalScheduleController.DEFAULT_TARGET_ARN, saved.target().arn());
        assertEquals("start", codec.readPayload(saved.target().input()).get("action"));
    }

    @Test
    void shouldRejectMissingExpression() throws Exception {
        mockMvc.perform(put("/api/schedules/agents/agent-loop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"timezone": "Asia/Tokyo", "payload": {"action": "start"}}
                                """))
                .andExpect(status().isBadRequest());

        verify(scheduleStore, never()).save(any());
    }

    @Test
    void shouldRejectRecurringExpression() throws Exception {
        mockMvc.perform(put("/api/schedules/agents/agent-loop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"scheduleExpression": "rate(5 minutes)", "timezone": "Asia/Tokyo", "payload": {}}
                                """))
                .andExpect(status().isBadRequest());

        verify(scheduleStore, never()).save(any());
    }

    @Test
    void shouldReturnNotFoundForUnknownSchedule() throws Exception {
        when(scheduleStore.get(any())).thenThrow(new ScheduleUpdateException(
                ScheduleUpdateException.Kind.RESOURCE_NOT_FOUND, "Schedule not found: agents/missing"));

        mockMvc.perform(get("/api/schedules/agents/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldReturnStoredSchedule() throws Exception {
        when(scheduleStore.get(new ScheduleIdentity("agent-loop", "agents"))).thenReturn(new ScheduleDefinition(
                new ScheduleIdentity("agent-loop", "agents"), "local:schedule/agents/agent-loop",
                "at(2025-01-01T00:05:00)", "Asia/Tokyo",
                new LocalScheduleTarget("local:runtime/self",
                        codec.wrap("local:runtime/self", Map.of("input", "hello")), Map.of()),
                null, "Local loop", null, null, "ENABLED", null, null));

        mockMvc.perform(get("/api/schedules/agents/agent-loop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.arn").value("local:schedule/agents/agent-loop"))
                .andExpect(jsonPath("$.description").value("Local loop"))
                .andExpect(jsonPath("$.payload.input").value("hello"));
    }
}
