package me.golemcore.recall.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import me.golemcore.recall.domain.model.LlmRequest;
import me.golemcore.recall.domain.model.Message;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jAdapterTest {

    private RecallProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RecallProperties();
        adapter = new Langchain4jAdapter(properties);
    }

    // ===== rate limits =====

    @Test
    void isRateLimitError_detectsKnownMessages() {
        assertTrue(adapter.isRateLimitError(new RuntimeException("rate_limit_exceeded")));
        assertTrue(adapter.isRateLimitError(new RuntimeException("HTTP 429")));
        assertTrue(adapter.isRateLimitError(new RuntimeException("Too Many Requests")));
        assertTrue(adapter.isRateLimitError(
                new RuntimeException("LLM failed", new RuntimeException("token_quota_exceeded"))));
    }

    @Test
    void isRateLimitError_returnsFalseForOtherErrors() {
        assertFalse(adapter.isRateLimitError(new RuntimeException("Connection refused")));
        assertFalse(adapter.isRateLimitError(new RuntimeException((String) null)));
    }

    @Test
    void extractResetSeconds_readsHintFromNestedCause() {
        RuntimeException ex = new RuntimeException("wrapper",
                new RuntimeException("{\"code\":\"token_quota_exceeded\",\"reset_seconds\": 12}"));

        assertEquals(12, adapter.extractResetSeconds(ex));
        assertEquals(-1, adapter.extractResetSeconds(new RuntimeException("no hint")));
    }

    // ===== model selection =====

    @Test
    void shouldSplitProviderPrefix() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-sonnet"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o-mini"));
        assertEquals("claude-sonnet", Langchain4jAdapter.stripProviderPrefix("anthropic/claude-sonnet"));
        assertEquals("gpt-4o-mini", Langchain4jAdapter.stripProviderPrefix("gpt-4o-mini"));
    }

    @Test
    void shouldRejectUnconfiguredProvider() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> adapter.createModel("openai/gpt-4o-mini"));

        assertTrue(ex.getMessage().contains("recall.llm.providers.openai.api-key"));
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());

        RecallProperties.ProviderProperties openai = new RecallProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put("openai", openai);

        assertTrue(adapter.isAvailable());
    }

    // ===== message conversion =====

    @Test
    void shouldConvertMessagesWithSystemPromptFirst() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("You extract events")
                .messages(List.of(
                        Message.user("hi"),
                        Message.assistant("hello"),
                        Message.builder().role("tool").content("odd").build()))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        assertInstanceOf(AiMessage.class, messages.get(2));
        assertInstanceOf(UserMessage.class, messages.get(3));
        assertEquals("You extract events", ((SystemMessage) messages.get(0)).text());
    }

    @Test
    void shouldOmitBlankSystemPrompt() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(" ")
                .messages(List.of(Message.user("hi")))
                .build();

        assertEquals(1, adapter.convertMessages(request).size());
    }
}
