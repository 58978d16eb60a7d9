package io.nextrun.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for the tools offered to the reasoning engine.
 *
 * <p>Each tool is an {@link AgentTool} plus a description and JSON schema; the
 * registry wraps it as a Spring AI {@link ToolCallback} so the model can discover
 * and call it. Registration happens at startup, lookups from any job thread.</p>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, AgentTool> agentTools = new ConcurrentHashMap<>();
    private final Map<String, ToolCallback> toolCallbacks = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Registers a tool with description and JSON schema, making it visible to the model.
     *
     * @param name        tool name
     * @param description human-readable description for the model
     * @param inputSchema JSON Schema string for the tool's parameters
     * @param tool        the tool implementation
     */
    public void registerAgentTool(String name, String description, String inputSchema, AgentTool tool) {
        agentTools.put(name, tool);
        toolCallbacks.put(name, new AgentToolCallback(name, description, inputSchema, this));
        log.debug("Registered agent tool: {}", name);
    }

    /**
     * Returns the callbacks of every registered tool.
     */
    public List<ToolCallback> getAllToolCallbacks() {
        return new ArrayList<>(toolCallbacks.values());
    }

    /**
     * Returns the names of every registered tool.
     */
    public List<String> getAllToolNames() {
        return new ArrayList<>(agentTools.keySet());
    }

    /**
     * Executes a tool by name with the given arguments.
     *
     * @param toolName  the tool to execute
     * @param arguments JSON string of arguments
     * @return the tool result, or an error result if the tool is unknown or throws
     */
    public AgentResult executeTool(String toolName, String arguments) {
        AgentTool agentTool = agentTools.get(toolName);
        if (agentTool == null) {
            log.error("Tool '{}' not found", toolName);
            return AgentResult.of("Error: Tool '" + toolName + "' not found.");
        }
        try {
            return agentTool.execute(parseArguments(arguments));
        } catch (Exception e) {
            log.error("Error executing agent tool '{}': {}", toolName, e.getMessage(), e);
            return AgentResult.of("Error: " + e.getMessage());
        }
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(arguments, new TypeReference<>() {});
        } catch (Exception e) {
            log.warn("Failed to parse tool arguments: {}", arguments, e);
            return Map.of();
        }
    }

    /**
     * A tool callable by the reasoning engine.
     */
    @FunctionalInterface
    public interface AgentTool {
        /**
         * Executes the tool with parsed arguments.
         */
        AgentResult execute(Map<String, Object> arguments);
    }

    /**
     * Wraps an AgentTool as a Spring AI ToolCallback.
     */
    static class AgentToolCallback implements ToolCallback {

        private final String name;
        private final String description;
        private final String inputSchema;
        private final ToolRegistry registry;

        AgentToolCallback(String name, String description, String inputSchema, ToolRegistry registry) {
            this.name = name;
            this.description = description;
            this.inputSchema = inputSchema;
            this.registry = registry;
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build();
        }

        @Override
        public String call(String toolInput) {
            log.debug("Model called tool '{}'", name);
            return registry.executeTool(name, toolInput).value();
        }
    }
}
