package com.jiracdc.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for operation progress.
 * <p>
 * Supports per-operation subscriptions and global subscriptions that receive all events.
 * Per-operation subscriber lists are dropped once the operation publishes its terminal
 * event, so registrations never outlive the operation they observe.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-operation subscribers keyed by operationId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OperationEvent>>> operationSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all operations. */
    private final CopyOnWriteArrayList<Consumer<OperationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (operation-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(OperationEvent event) {
        log.debug("Publishing event: {} for operation {}", event.eventType(), event.operationId());

        List<Consumer<OperationEvent>> subs = event.isTerminal()
                ? operationSubscribers.remove(event.operationId())
                : operationSubscribers.get(event.operationId());
        if (subs != null) {
            for (Consumer<OperationEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<OperationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific operation. The subscription ends automatically
     * after the operation's terminal event.
     *
     * @param operationId the operation to subscribe to
     * @param consumer    callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe earlier
     */
    public Subscription subscribe(String operationId, Consumer<OperationEvent> consumer) {
        operationSubscribers.computeIfAbsent(operationId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to operation {}", operationId);
        return () -> operationSubscribers.computeIfPresent(operationId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to events from all operations.
     *
     * @param consumer callback invoked for each event regardless of operation
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<OperationEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Number of operations that currently have dedicated subscribers. */
    public int activeOperationSubscriptions() {
        return operationSubscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OperationEvent> subscriber, OperationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
