package com.regwatch.core.bus;

import com.regwatch.core.events.Event;
import com.regwatch.core.events.SweepCompleted;
import com.regwatch.core.events.SweepStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(SweepStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(SweepStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new SweepStarted(NOW, "scheduled", 10));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger startedHits = new AtomicInteger();
        AtomicInteger completedHits = new AtomicInteger();

        bus.subscribe(SweepStarted.class, event -> startedHits.incrementAndGet());
        bus.subscribe(SweepCompleted.class, event -> completedHits.incrementAndGet());

        bus.publish(new SweepStarted(NOW, "manual", 2));
        bus.publish(new SweepCompleted(NOW.plusSeconds(4), 2, 0, 0, 4000, false));

        assertEquals(1, startedHits.get());
        assertEquals(1, completedHits.get());
    }

    @Test
    void catchAllSubscriberSeesEveryEventInOrder() {
        EventBus bus = new EventBus();
        List<String> seen = new CopyOnWriteArrayList<>();
        bus.subscribeAll(event -> seen.add(event.type()));

        bus.publish(new SweepStarted(NOW, "manual", 1));
        bus.publish(new SweepCompleted(NOW, 1, 0, 1, 10, false));

        assertEquals(List.of("SweepStarted", "SweepCompleted"), seen);
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

        bus.subscribe(SweepStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(SweepStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new SweepStarted(NOW, "scheduled", 3));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
        assertEquals("SweepStarted", failedEvent.get().type());
    }
}
