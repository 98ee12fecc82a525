package me.golemcore.recall.adapter.outbound.llm;

import me.golemcore.recall.domain.model.LlmRequest;
import me.golemcore.recall.domain.model.LlmResponse;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldAnswerWithEmptyJsonObject() throws ExecutionException, InterruptedException {
        LlmResponse response = adapter.chat(LlmRequest.builder().build()).get();

        assertEquals("{}", response.getContent());
        assertEquals("none", response.getModel());
        assertEquals("stop", response.getFinishReason());
        assertEquals(0, response.getUsage().getTotalTokens());
    }

    @Test
    void shouldReportUnavailable() {
        assertEquals("none", adapter.getProviderId());
        assertEquals("none", adapter.getCurrentModel());
        assertTrue(adapter.getSupportedModels().isEmpty());
        assertFalse(adapter.isAvailable());
    }
}
