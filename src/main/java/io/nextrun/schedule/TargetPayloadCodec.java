package io.nextrun.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and rewrites the nested payload carried in a schedule target's input.
 *
 * <p>The target input is a JSON envelope whose {@code Payload} field is itself a
 * JSON document serialized as a string:</p>
 * <pre>
 * {"AgentRuntimeArn": "arn:...", "Payload": "{\"action\":\"start\",\"input\":\"...\"}"}
 * </pre>
 * <p>Only the inner {@code input} field is ever changed. Sibling keys keep their
 * values and order at both levels.</p>
 */
@Component
public class TargetPayloadCodec {

    public static final String PAYLOAD_FIELD = "Payload";
    public static final String RUNTIME_ARN_FIELD = "AgentRuntimeArn";
    public static final String INPUT_FIELD = "input";

    private final ObjectMapper objectMapper;

    public TargetPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false)
                .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
    }

    /**
     * Returns the target input with the inner payload's {@code input} replaced.
     *
     * @throws ScheduleUpdateException with kind INVALID_PAYLOAD if either level is not a JSON object
     */
    public String replaceInput(String targetInput, String nextInput) {
        ObjectNode envelope = readObject(targetInput, "target input");
        ObjectNode payload = readObject(payloadText(envelope), PAYLOAD_FIELD);
        payload.put(INPUT_FIELD, nextInput);
        try {
            envelope.put(PAYLOAD_FIELD, objectMapper.writeValueAsString(payload));
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_PAYLOAD,
                    "Failed to serialize target input", e);
        }
    }

    /**
     * Decodes the inner payload of a target input into a map.
     */
    public Map<String, Object> readPayload(String targetInput) {
        ObjectNode payload = readObject(payloadText(readObject(targetInput, "target input")), PAYLOAD_FIELD);
        return objectMapper.convertValue(payload, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    /**
     * Builds a target input envelope around a payload.
     */
    public String wrap(String runtimeArn, Map<String, Object> payload) {
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put(RUNTIME_ARN_FIELD, runtimeArn);
            envelope.put(PAYLOAD_FIELD, objectMapper.writeValueAsString(payload));
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_PAYLOAD,
                    "Failed to serialize payload", e);
        }
    }

    private String payloadText(ObjectNode envelope) {
        JsonNode payload = envelope.get(PAYLOAD_FIELD);
        if (payload == null || !payload.isTextual()) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_PAYLOAD,
                    "Target input has no '" + PAYLOAD_FIELD + "' string");
        }
        return payload.asText();
    }

    private ObjectNode readObject(String json, String what) {
        if (json == null || json.isBlank()) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_PAYLOAD, what + " is empty");
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node instanceof ObjectNode object) {
                return object;
            }
        } catch (JsonProcessingException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_PAYLOAD,
                    what + " is not valid JSON", e);
        }
        throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_PAYLOAD,
                what + " is not a JSON object");
    }
}
