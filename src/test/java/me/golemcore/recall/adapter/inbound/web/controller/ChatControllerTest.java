package me.golemcore.recall.adapter.inbound.web.controller;

import me.golemcore.recall.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.recall.domain.model.ChatAnswer;
import me.golemcore.recall.domain.model.ChatTurn;
import me.golemcore.recall.domain.service.LlmCallException;
import me.golemcore.recall.domain.service.MemoryChatService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ChatControllerTest {

    private MemoryChatService chatService;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        chatService = mock(MemoryChatService.class);
        controller = new ChatController(chatService);
    }

    @Test
    void shouldAnswerWithHistory() {
        List<ChatTurn> history = List.of(new ChatTurn("user", "hi"), new ChatTurn("assistant", "hello"));
        ChatAnswer answer = ChatAnswer.builder().response("You have a standup at 9:30").eventsInContext(4).build();
        when(chatService.answer("what's tomorrow?", history)).thenReturn(answer);

        ChatRequest request = ChatRequest.builder().query("what's tomorrow?").history(history).build();

        assertSame(answer, controller.chat(request).block().getBody());
    }

    @Test
    void shouldPropagateModelFailure() {
        when(chatService.answer(eq("q"), anyList())).thenThrow(new LlmCallException("timeout", null));

        StepVerifier.create(controller.chat(ChatRequest.builder().query("q").build()))
                .expectError(LlmCallException.class)
                .verify();
    }
}
