package me.golemcore.recall.adapter.inbound.web.controller;

import me.golemcore.recall.adapter.inbound.web.dto.SnoozeRequest;
import me.golemcore.recall.domain.model.EventChanges;
import me.golemcore.recall.domain.model.EventDetails;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.PendingAction;
import me.golemcore.recall.domain.service.EventLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EventsControllerTest {

    private EventLifecycleService lifecycleService;
    private EventsController controller;

    private final MemoryEvent event = MemoryEvent.builder().id(1L).title("Netflix renewal")
            .status(EventStatus.SCHEDULED).build();

    @BeforeEach
    void setUp() {
        lifecycleService = mock(EventLifecycleService.class);
        controller = new EventsController(lifecycleService);
    }

    @Test
    void shouldListEvents() {
        when(lifecycleService.listEvents("all", 50, 0)).thenReturn(List.of(event));

        ResponseEntity<List<MemoryEvent>> response = controller.listEvents("all", 50, 0).block();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(List.of(event), response.getBody());
    }

    @Test
    void shouldReturnEventDetails() {
        EventDetails details = new EventDetails(event, List.of(), false);
        when(lifecycleService.getEvent(1L)).thenReturn(details);

        assertSame(details, controller.getEvent(1L).block().getBody());
    }

    @Test
    void shouldRouteStatusChanges() {
        when(lifecycleService.complete(1L)).thenReturn(event);
        when(lifecycleService.ignore(1L)).thenReturn(event);
        when(lifecycleService.schedule(1L)).thenReturn(event);

        controller.complete(1L).block();
        controller.ignore(1L).block();
        controller.setReminder(1L).block();

        verify(lifecycleService).complete(1L);
        verify(lifecycleService).ignore(1L);
        verify(lifecycleService).schedule(1L);
    }

    @Test
    void shouldSnoozeWithOptionalBody() {
        when(lifecycleService.snooze(eq(1L), any())).thenReturn(event);

        controller.snooze(1L, null).block();
        controller.snooze(1L, new SnoozeRequest(90)).block();

        verify(lifecycleService).snooze(1L, null);
        verify(lifecycleService).snooze(1L, 90);
    }

    @Test
    void shouldConfirmPendingAction() {
        PendingAction pending = PendingAction.builder().targetEventId(1L)
                .changes(EventChanges.builder().location("Cafe X").build()).build();
        when(lifecycleService.confirm(1L, pending)).thenReturn(event);

        assertSame(event, controller.confirm(1L, pending).block().getBody());
    }

    @Test
    void shouldDeleteEvent() {
        ResponseEntity<EventsController.DeleteResponse> response = controller.delete(3L).block();

        assertTrue(response.getBody().success());
        assertEquals(3L, response.getBody().id());
        verify(lifecycleService).delete(3L);
    }

    @Test
    void shouldSurfaceServiceErrorsAsErrorSignals() {
        doThrow(new NoSuchElementException("Event not found: 9")).when(lifecycleService).delete(9L);

        StepVerifier.create(controller.delete(9L))
                .expectError(NoSuchElementException.class)
                .verify();
    }
}
