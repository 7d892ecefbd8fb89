package com.jiracdc.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    private static OperationEvent event(String type, String operationId) {
        return new OperationEvent(type, operationId, null, Map.of(), Instant.now());
    }

    @Test
    @DisplayName("operation subscribers only see their operation")
    void scopedDelivery() {
        var received = new ArrayList<String>();
        bus.subscribe("op-1", e -> received.add(e.eventType()));

        bus.publish(event("operation.started", "op-1"));
        bus.publish(event("operation.started", "op-2"));

        assertEquals(List.of("operation.started"), received);
    }

    @Test
    @DisplayName("global subscribers see every operation")
    void globalDelivery() {
        var received = new ArrayList<String>();
        bus.subscribeAll(e -> received.add(e.operationId()));

        bus.publish(event("task.started", "op-1"));
        bus.publish(event("task.started", "op-2"));

        assertEquals(List.of("op-1", "op-2"), received);
    }

    @Test
    @DisplayName("the terminal event is delivered and then the subscription is dropped")
    void terminalEventEndsSubscription() {
        var received = new ArrayList<String>();
        bus.subscribe("op-1", e -> received.add(e.eventType()));

        bus.publish(event("operation.completed", "op-1"));
        bus.publish(event("operation.progress", "op-1"));

        assertEquals(List.of("operation.completed"), received);
        assertEquals(0, bus.activeOperationSubscriptions());
    }

    @Test
    @DisplayName("unsubscribe stops delivery and releases the operation entry")
    void unsubscribe() {
        var received = new ArrayList<String>();
        var subscription = bus.subscribe("op-1", e -> received.add(e.eventType()));
        subscription.unsubscribe();

        bus.publish(event("operation.started", "op-1"));

        assertTrue(received.isEmpty());
        assertEquals(0, bus.activeOperationSubscriptions());
    }

    @Test
    @DisplayName("a throwing subscriber does not block the others")
    void failingSubscriberIsolated() {
        var received = new ArrayList<String>();
        bus.subscribe("op-1", e -> { throw new IllegalStateException("boom"); });
        bus.subscribe("op-1", e -> received.add(e.eventType()));

        assertDoesNotThrow(() -> bus.publish(event("operation.started", "op-1")));
        assertEquals(List.of("operation.started"), received);
    }

    @Test
    @DisplayName("completed, failed and cancelled are terminal")
    void terminalTypes() {
        assertTrue(event("operation.completed", "x").isTerminal());
        assertTrue(event("operation.failed", "x").isTerminal());
        assertTrue(event("operation.cancelled", "x").isTerminal());
        assertFalse(event("task.failed", "x").isTerminal());
    }
}
