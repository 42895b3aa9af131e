package com.geoledger.core.bus;

import com.geoledger.core.events.TicketSkipped;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EventBusConcurrencyTest {
    @Test
    void concurrentPublishInvokesAllSubscribers() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("No handler should fail in this test", error);
        });

        int subscriberCount = 8;
        int publishCount = 1_000;
        LongAdder invocations = new LongAdder();

        for (int i = 0; i < subscriberCount; i++) {
            bus.subscribe(TicketSkipped.class, event -> invocations.increment());
        }

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[publishCount];
            for (int i = 0; i < publishCount; i++) {
                String key = "T-" + i;
                futures[i] = executor.submit(() ->
                        bus.publish(new TicketSkipped(Instant.now(), "run-1", "stage_1_api", key, "LOCKED", "")));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals((long) subscriberCount * publishCount, invocations.sum());
    }
}
