package io.nextrun.config;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ModelRouterTest {

    private final ChatModel anthropic = mock(ChatModel.class);
    private final ChatModel openai = mock(ChatModel.class);

    @Test
    void shouldRouteExplicitProviders() {
        var router = new ModelRouter(anthropic, openai);
        assertEquals(anthropic, router.resolve("anthropic:claude-sonnet-4-5").chatModel());
        assertEquals("claude-sonnet-4-5", router.resolve("anthropic:claude-sonnet-4-5").modelName());
        assertEquals(openai, router.resolve("openai:gpt-4.1").chatModel());
    }

    @Test
    void shouldDefaultToAnthropic() {
        var router = new ModelRouter(anthropic, openai);
        var resolved = router.resolve("");
        assertEquals(anthropic, resolved.chatModel());
        assertEquals("anthropic", resolved.provider());
        assertEquals(ModelRouter.DEFAULT_ANTHROPIC_MODEL, resolved.modelName());
    }

    @Test
    void shouldDefaultToOpenAiWhenNoAnthropic() {
        var router = new ModelRouter(null, openai);
        assertEquals(openai, router.resolve(null).chatModel());
        assertEquals(ModelRouter.DEFAULT_OPENAI_MODEL, router.resolve(null).modelName());
    }

    @Test
    void shouldThrowWhenNoProviders() {
        assertThrows(IllegalStateException.class, () -> new ModelRouter(null, null));
    }

    @Test
    void shouldAutoDetectByModelName() {
        var router = new ModelRouter(anthropic, openai);
        assertEquals("anthropic", router.resolve("claude-haiku-4-5").provider());
        assertEquals("openai", router.resolve("gpt-4.1-mini").provider());
        assertEquals("openai", router.resolve("o4-mini").provider());
    }

    @Test
    void shouldFallBackToDefaultForUnknownProvider() {
        var router = new ModelRouter(anthropic, openai);
        var resolved = router.resolve("ollama:llama3");
        assertEquals(anthropic, resolved.chatModel());
        assertEquals("llama3", resolved.modelName());
    }
}
