package com.geoledger.core.bus;

import com.geoledger.core.events.AlertRaised;
import com.geoledger.core.events.Event;
import com.geoledger.core.events.StageStarted;
import com.geoledger.core.events.TicketSkipped;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger startedHits = new AtomicInteger();
        AtomicInteger skippedHits = new AtomicInteger();

        bus.subscribe(StageStarted.class, event -> startedHits.incrementAndGet());
        bus.subscribe(TicketSkipped.class, event -> skippedHits.incrementAndGet());

        bus.publish(new StageStarted(NOW, "run-1", "stage_1_api", 0, 2, 10));
        bus.publish(new TicketSkipped(NOW, "run-1", "stage_1_api", "T-1", "LOCKED", "locked: verified"));
        bus.publish(new TicketSkipped(NOW, "run-1", "stage_1_api", "T-2", "SAME_STAGE", ""));

        assertEquals(1, startedHits.get());
        assertEquals(2, skippedHits.get());
    }

    @Test
    void subscribeAllSeesEveryEventInOrder() {
        EventBus bus = new EventBus();
        List<String> types = new ArrayList<>();
        bus.subscribeAll(event -> types.add(event.type()));

        bus.publish(new StageStarted(NOW, "run-1", "stage_1_api", 0, 1, 1));
        bus.publish(new AlertRaised(NOW, "storage", "disk full", Map.of()));

        assertEquals(List.of("StageStarted", "AlertRaised"), types);
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        AtomicReference<Event> failedEvent = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> {
            failedEvent.set(event);
            capturedError.set(error);
        });
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(StageStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(StageStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new StageStarted(NOW, "run-1", "stage_1_api", 0, 1, 1));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
        assertEquals("StageStarted", failedEvent.get().type());
    }
}
