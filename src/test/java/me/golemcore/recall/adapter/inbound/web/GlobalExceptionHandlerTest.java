package me.golemcore.recall.adapter.inbound.web;

import me.golemcore.recall.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.recall.domain.service.LlmCallException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldKeepResponseStatusReason() {
        assertError(handler.handleResponseStatus(new ResponseStatusException(HttpStatus.BAD_REQUEST, "URL required")),
                HttpStatus.BAD_REQUEST, "URL required");
    }

    @Test
    void shouldMapDomainExceptions() {
        assertError(handler.handleIllegalArgument(new IllegalArgumentException("Invalid URL: x")),
                HttpStatus.BAD_REQUEST, "Invalid URL: x");
        assertError(handler.handleNotFound(new NoSuchElementException("Event not found: 9")),
                HttpStatus.NOT_FOUND, "Event not found: 9");
        assertError(handler.handleIllegalState(new IllegalStateException("Cannot move completed -> snoozed")),
                HttpStatus.CONFLICT, "Cannot move completed -> snoozed");
    }

    @Test
    void shouldHideInternalDetails() {
        assertError(handler.handleLlmFailure(new LlmCallException("401 from provider", null)),
                HttpStatus.BAD_GATEWAY, "Language model unavailable");
        assertError(handler.handleGeneric(new RuntimeException("disk on fire")),
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static void assertError(Mono<ResponseEntity<ApiErrorResponse>> mono, HttpStatus status, String message) {
        StepVerifier.create(mono)
                .assertNext(response -> {
                    assertEquals(status, response.getStatusCode());
                    assertEquals(status.value(), response.getBody().getStatus());
                    assertEquals(message, response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
