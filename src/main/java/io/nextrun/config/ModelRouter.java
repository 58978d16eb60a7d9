package io.nextrun.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Routes a model string to the configured ChatModel provider.
 *
 * <ul>
 *   <li>{@code "claude-haiku-4-5"}: auto-detected as Anthropic</li>
 *   <li>{@code "anthropic:claude-sonnet-4-5"}: explicit Anthropic</li>
 *   <li>{@code "openai:gpt-4.1-mini"}: explicit OpenAI</li>
 * </ul>
 */
@Component
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);
    static final String DEFAULT_ANTHROPIC_MODEL = "claude-haiku-4-5";
    static final String DEFAULT_OPENAI_MODEL = "gpt-4.1-mini";

    private final Map<String, ChatModel> providers = new HashMap<>();
    private final ChatModel defaultModel;
    private final String defaultProvider;

    @Autowired
    public ModelRouter(
            @Autowired(required = false) @Qualifier("anthropicChatModel") ChatModel anthropicChatModel,
            @Autowired(required = false) @Qualifier("openAiChatModel") ChatModel openAiChatModel
    ) {
        if (anthropicChatModel != null) providers.put("anthropic", anthropicChatModel);
        if (openAiChatModel != null) providers.put("openai", openAiChatModel);

        // Anthropic > OpenAI
        this.defaultModel = anthropicChatModel != null ? anthropicChatModel : openAiChatModel;
        this.defaultProvider = anthropicChatModel != null ? "anthropic" : "openai";

        if (this.defaultModel == null) {
            throw new IllegalStateException("At least one AI provider must be configured (Anthropic or OpenAI)");
        }
        log.info("ModelRouter initialized with providers: {} (default: {})", providers.keySet(), defaultProvider);
    }

    /**
     * Resolves a model string to a ChatModel and the model name to request.
     *
     * @param modelSpec model specification, blank for the default provider's default model
     */
    public ResolvedModel resolve(String modelSpec) {
        if (modelSpec == null || modelSpec.isBlank()) {
            return new ResolvedModel(defaultModel, defaultModelName(defaultProvider), defaultProvider);
        }

        int colonIdx = modelSpec.indexOf(':');
        if (colonIdx > 0) {
            String provider = modelSpec.substring(0, colonIdx).toLowerCase();
            String modelName = modelSpec.substring(colonIdx + 1);
            ChatModel chatModel = providers.get(provider);
            if (chatModel != null) {
                return new ResolvedModel(chatModel, modelName, provider);
            }
            log.warn("Unknown provider '{}', falling back to default", provider);
            return new ResolvedModel(defaultModel, modelName, defaultProvider);
        }

        String lower = modelSpec.toLowerCase();
        if (lower.startsWith("claude") && providers.containsKey("anthropic")) {
            return new ResolvedModel(providers.get("anthropic"), modelSpec, "anthropic");
        }
        if ((lower.startsWith("gpt-") || lower.startsWith("o3") || lower.startsWith("o4"))
                && providers.containsKey("openai")) {
            return new ResolvedModel(providers.get("openai"), modelSpec, "openai");
        }
        return new ResolvedModel(defaultModel, modelSpec, defaultProvider);
    }

    private static String defaultModelName(String provider) {
        return "anthropic".equals(provider) ? DEFAULT_ANTHROPIC_MODEL : DEFAULT_OPENAI_MODEL;
    }

    /**
     * Result of model resolution.
     *
     * @param chatModel the Spring AI ChatModel to use
     * @param modelName the model name to pass in options
     * @param provider  the provider name
     */
    public record ResolvedModel(ChatModel chatModel, String modelName, String provider) {}
}
