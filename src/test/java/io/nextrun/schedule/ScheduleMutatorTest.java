package io.nextrun.schedule;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleMutatorTest {

    private static final Instant NOW = Instant.parse("2024-12-31T15:00:00Z");
    private static final ScheduleIdentity IDENTITY = new ScheduleIdentity("agent-loop", "agents");
    private static final String ARN = "arn:aws:scheduler:ap-northeast-1:123456789012:schedule/agents/agent-loop";

    private InMemoryScheduleStore store;
    private TargetPayloadCodec codec;
    private ScheduleMutator mutator;
    private ScheduleDefinition original;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        codec = new TargetPayloadCodec(new ObjectMapper());
        mutator = new ScheduleMutator(store, codec, "agent-loop", "agents");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", "start");
        payload.put("job_id", "daily");
        payload.put("input", "Execution #1: collect headlines");
        payload.put("seconds", 0);
        String input = codec.wrap("arn:aws:bedrock-agentcore:rt", payload);

        original = new ScheduleDefinition(IDENTITY, ARN, "at(2024-12-31T23:00:00)", "Asia/Tokyo",
                new TestTarget("arn:aws:bedrock-agentcore:rt", input, "role-arn"),
                new FlexibleTimeWindow("FLEXIBLE", 15), "Self-scheduling agent",
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:00:00Z"),
                ScheduleDefinition.STATE_ENABLED, "arn:aws:kms:key", "NONE");
        store.put(original);
    }

    @Test
    void shouldRescheduleRelativeToNowInTargetZone() {
        ScheduleUpdateResult result = mutator.reschedule(NOW, "+5m", null, "Asia/Tokyo");

        assertEquals("at(2025-01-01T00:05:00)", result.newExpression());
        assertEquals("Asia/Tokyo", result.timezone());
        assertEquals("agent-loop", result.scheduleName());
        assertEquals("agents", result.groupName());
        assertEquals(ARN, result.scheduleArn());
        assertNull(result.nextInput());
        assertEquals(1, store.updates.size());
    }

    @Test
    void shouldWriteExpressionThatParsesBackToResolvedInstant() {
        mutator.reschedule(NOW, "+2h", null, "America/New_York");

        ScheduleDefinition written = store.updates.get(0);
        assertEquals("America/New_York", written.timezone());
        assertEquals(NOW.plusSeconds(7200),
                ScheduleExpressions.parseAt(written.scheduleExpression(), ZoneId.of("America/New_York")));
    }

    @Test
    void shouldKeepEveryOtherFieldWhenInputIsNull() {
        mutator.reschedule(NOW, "+1d", null, "Asia/Tokyo");

        ScheduleDefinition written = store.updates.get(0);
        assertEquals(original.withSchedule(written.scheduleExpression(), written.timezone()), written);
        assertSame(original.target(), written.target());
    }

    @Test
    void shouldReplaceOnlyNestedInput() {
        ScheduleUpdateResult result = mutator.reschedule(NOW, "+30m", "Execution #2: summarize", "Asia/Tokyo");

        ScheduleDefinition written = store.updates.get(0);
        Map<String, Object> payload = codec.readPayload(written.target().input());
        assertEquals("Execution #2: summarize", payload.get("input"));
        assertEquals("start", payload.get("action"));
        assertEquals("daily", payload.get("job_id"));
        assertEquals(0, payload.get("seconds"));
        assertEquals("role-arn", ((TestTarget) written.target()).roleArn());
        assertEquals(original.description(), written.description());
        assertEquals(original.flexibleTimeWindow(), written.flexibleTimeWindow());
        assertEquals(original.kmsKeyArn(), written.kmsKeyArn());
        assertEquals("Execution #2: summarize", result.nextInput());
    }

    @Test
    void shouldInterpretLocalTimestampInTimezone() {
        ScheduleUpdateResult result = mutator.reschedule(NOW, "2025-01-01T09:30:00", null, "Asia/Tokyo");

        assertEquals("at(2025-01-01T09:30:00)", result.newExpression());
    }

    @Test
    void shouldConvertOffsetTimestampToTimezone() {
        ScheduleUpdateResult result = mutator.reschedule(NOW, "2025-01-01T00:00:00Z", null, "Asia/Tokyo");

        assertEquals("at(2025-01-01T09:00:00)", result.newExpression());
    }

    @Test
    void shouldAcceptSpaceSeparatedAndDateOnlyTimestamps() {
        assertEquals(Instant.parse("2025-01-01T01:00:00Z"),
                ScheduleMutator.resolve(NOW, "2025-01-01 10:00:00", ZoneId.of("Asia/Tokyo")));
        assertEquals(Instant.parse("2025-01-01T15:00:00Z"),
                ScheduleMutator.resolve(NOW, "2025-01-02", ZoneId.of("Asia/Tokyo")));
    }

    @Test
    void shouldRejectPastTimeWithoutWriting() {
        var e = assertThrows(ScheduleUpdateException.class,
                () -> mutator.reschedule(NOW, "2020-01-01T00:00:00", "x", "Asia/Tokyo"));

        assertEquals(ScheduleUpdateException.Kind.PAST_OR_PRESENT_TIME, e.getKind());
        assertTrue(e.getMessage().startsWith("Next execution time must be in the future."));
        assertEquals(0, store.reads);
        assertTrue(store.updates.isEmpty());
    }

    @Test
    void shouldRejectPresentTime() {
        var e = assertThrows(ScheduleUpdateException.class,
                () -> mutator.reschedule(NOW, "+0m", null, "Asia/Tokyo"));

        assertEquals(ScheduleUpdateException.Kind.PAST_OR_PRESENT_TIME, e.getKind());
        assertTrue(store.updates.isEmpty());
    }

    @Test
    void shouldRejectInvalidFormatBeforeAnyStoreCall() {
        var relative = assertThrows(ScheduleUpdateException.class,
                () -> mutator.reschedule(NOW, "+5x", null, "Asia/Tokyo"));
        var absolute = assertThrows(ScheduleUpdateException.class,
                () -> mutator.reschedule(NOW, "next tuesday", null, "Asia/Tokyo"));
        var zone = assertThrows(ScheduleUpdateException.class,
                () -> mutator.reschedule(NOW, "+5m", null, "Not/AZone"));

        assertEquals(ScheduleUpdateException.Kind.INVALID_FORMAT, relative.getKind());
        assertEquals(ScheduleUpdateException.Kind.INVALID_FORMAT, absolute.getKind());
        assertEquals(ScheduleUpdateException.Kind.INVALID_FORMAT, zone.getKind());
        assertEquals(0, store.reads);
    }

    @Test
    void shouldRejectTimesBeyondRenderableRangeBeforeAnyStoreCall() {
        var pastYear9999 = assertThrows(ScheduleUpdateException.class,
                () -> mutator.reschedule(NOW, "+3000000d", null, "Asia/Tokyo"));
        var pastLocalDateTimeMax = assertThrows(ScheduleUpdateException.class,
                () -> mutator.reschedule(NOW, "+365241760600d", null, "Asia/Tokyo"));

        assertEquals(ScheduleUpdateException.Kind.INVALID_FORMAT, pastYear9999.getKind());
        assertEquals(ScheduleUpdateException.Kind.INVALID_FORMAT, pastLocalDateTimeMax.getKind());
        assertEquals(0, store.reads);
        assertTrue(store.updates.isEmpty());
    }

    @Test
    void shouldRequireConfiguredScheduleName() {
        var unconfigured = new ScheduleMutator(store, codec, "", "agents");

        var e = assertThrows(ScheduleUpdateException.class,
                () -> unconfigured.reschedule(NOW, "+5m", null, "Asia/Tokyo"));

        assertEquals(ScheduleUpdateException.Kind.CONFIGURATION_MISSING, e.getKind());
        assertEquals(0, store.reads);
    }

    @Test
    void shouldDefaultGroupName() {
        var mutatorWithoutGroup = new ScheduleMutator(store, codec, "agent-loop", "");

        assertEquals(new ScheduleIdentity("agent-loop", "default"), mutatorWithoutGroup.identity());
    }

    @Test
    void shouldReportMissingSchedule() {
        var other = new ScheduleMutator(store, codec, "missing", "agents");

        var e = assertThrows(ScheduleUpdateException.class,
                () -> other.reschedule(NOW, "+5m", null, "Asia/Tokyo"));

        assertEquals(ScheduleUpdateException.Kind.RESOURCE_NOT_FOUND, e.getKind());
        assertTrue(store.updates.isEmpty());
    }

    @Test
    void shouldRejectTargetWithoutEnvelopeWhenInputGiven() {
        store.put(original.withTarget(new TestTarget("arn:rt", "plain text", "role-arn")));

        var e = assertThrows(ScheduleUpdateException.class,
                () -> mutator.reschedule(NOW, "+5m", "next", "Asia/Tokyo"));

        assertEquals(ScheduleUpdateException.Kind.INVALID_PAYLOAD, e.getKind());
        assertTrue(store.updates.isEmpty());
    }

    @Test
    void shouldLetLastWriterWin() {
        mutator.reschedule(NOW, "+10m", "first", "Asia/Tokyo");
        mutator.reschedule(NOW, "+20m", "second", "Asia/Tokyo");

        ScheduleDefinition current = store.get(IDENTITY);
        assertEquals("at(2025-01-01T00:20:00)", current.scheduleExpression());
        assertEquals("second", codec.readPayload(current.target().input()).get("input"));
    }

    record TestTarget(String arn, String input, String roleArn) implements ScheduleTarget {
        @Override
        public ScheduleTarget withInput(String input) {
            return new TestTarget(arn, input, roleArn);
        }
    }
}
