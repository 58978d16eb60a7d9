package io.nextrun.core;

import io.nextrun.config.ModelRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reasoning engine backed by a Spring AI chat model.
 *
 * <p>Each invocation sends the configured instructions and the job input to the
 * model with every registered tool attached. Spring AI executes tool calls
 * internally and loops until the model answers without calling a tool, so one
 * {@link #invoke} is one complete agent run, including any
 * {@code update_next_schedule} call the model decides to make.</p>
 */
@Component
public class AgentRunner implements ReasoningEngine {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final ModelRouter modelRouter;
    private final ToolRegistry toolRegistry;
    private final String model;
    private final String instructions;
    private final int maxTokens;

    public AgentRunner(ModelRouter modelRouter, ToolRegistry toolRegistry,
                       @Value("${agent.model:}") String model,
                       @Value("${agent.instructions:You are a pragmatic research agent that runs on a schedule.}") String instructions,
                       @Value("${agent.max-tokens:4096}") int maxTokens) {
        this.modelRouter = modelRouter;
        this.toolRegistry = toolRegistry;
        this.model = model;
        this.instructions = instructions;
        this.maxTokens = maxTokens;
    }

    @Override
    public String invoke(String input) {
        ModelRouter.ResolvedModel resolved = modelRouter.resolve(model);
        log.debug("Using provider '{}' with model '{}'", resolved.provider(), resolved.modelName());

        List<ToolCallback> tools = toolRegistry.getAllToolCallbacks();
        if (!tools.isEmpty()) {
            log.debug("Passing {} tool callbacks to LLM: {}", tools.size(),
                    tools.stream().map(tc -> tc.getToolDefinition().name()).toList());
        }

        ChatOptions chatOptions = ToolCallingChatOptions.builder()
                .model(resolved.modelName())
                .maxTokens(maxTokens)
                .toolCallbacks(tools)
                .internalToolExecutionEnabled(true)
                .build();

        List<Message> messages = List.of(new SystemMessage(systemInstructions()), new UserMessage(input));

        ChatResponse response = ChatClient.builder(resolved.chatModel())
                .build()
                .prompt()
                .messages(messages)
                .options(chatOptions)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null) {
            throw new IllegalStateException("Model '" + resolved.modelName() + "' returned no result");
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text : "";
    }

    private String systemInstructions() {
        List<String> toolNames = toolRegistry.getAllToolNames();
        if (toolNames.isEmpty()) {
            return instructions;
        }
        return instructions + "\n\nYou have the following tools available: " + String.join(", ", toolNames) + ".";
    }
}
