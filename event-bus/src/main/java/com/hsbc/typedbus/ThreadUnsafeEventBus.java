package com.hsbc.typedbus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded event bus with immediate and deferred delivery.
 *
 * <p>Subscribers are registered through {@link Subscription} handles, each carrying a
 * subscriber id that is unique for the lifetime of the bus and never reused. Callbacks run
 * synchronously on the caller's thread.
 *
 * <p><b>Thread Safety:</b> This implementation is NOT thread-safe. All access must be
 * from a single thread or externally synchronized.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>A {@link RuntimeException} thrown by a callback is logged and counted; the remaining
 *       callbacks still run</li>
 *   <li>An {@link Error} is logged and propagates to the caller</li>
 *   <li>Callbacks may subscribe or unsubscribe while being dispatched to; callbacks removed
 *       mid-dispatch are skipped, callbacks added mid-dispatch first run on the next
 *       dispatch</li>
 * </ul>
 *
 * <p><b>Performance Characteristics:</b>
 * <ul>
 *   <li>Dispatching an event: O(n) where n is the number of callbacks for its type</li>
 *   <li>Enqueueing an event: O(1) amortized</li>
 *   <li>Registering a callback: O(s) where s is the number of subscribers for its type</li>
 *   <li>Removing a subscriber from all types: O(total subscriber groups)</li>
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * ThreadUnsafeEventBus bus = new ThreadUnsafeEventBus();
 * try (Subscription subscription = bus.subscribe()) {
 *     subscription.on(OrderPlaced.class, order -> ship(order));
 *     bus.emitNow(new OrderPlaced(...));
 *     bus.enqueue(new OrderPlaced(...));
 *     bus.flush();
 * }
 * }</pre>
 */
public class ThreadUnsafeEventBus implements EventBus, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ThreadUnsafeEventBus.class);

    private static final EventTypeKey DEAD_EVENT_KEY = EventTypeKey.of(DeadEvent.class);

    private final SubscriberRegistry registry = new SubscriberRegistry();
    private final Deque<PendingEvent> pendingEvents = new ArrayDeque<>();
    private final boolean handleDeadEvents;

    private long lastSubscriberId = 0;
    private boolean closed = false;

    // Metrics - simple primitives since we're single-threaded
    private long totalEventsDispatched = 0;
    private long deadEventCount = 0;
    private long subscriberFailureCount = 0;

    /**
     * Creates a new bus with dead-event handling disabled.
     */
    public ThreadUnsafeEventBus() {
        this(false);
    }

    /**
     * Creates a new bus.
     *
     * @param handleDeadEvents if true, dispatches a {@link DeadEvent} when an event has no subscribers
     */
    public ThreadUnsafeEventBus(boolean handleDeadEvents) {
        this.handleDeadEvents = handleDeadEvents;
    }

    @Override
    public <E> void emitNow(E event) {
        EventTypeKey key = EventTypeKey.forEvent(event);
        ensureNotClosed();
        totalEventsDispatched++;
        dispatch(key, event, false);
    }

    @Override
    public <E> void emitNow(Class<E> eventType, E event) {
        EventTypeKey key = keyFor(eventType, event);
        ensureNotClosed();
        totalEventsDispatched++;
        dispatch(key, event, false);
    }

    @Override
    public <E> void enqueue(E event) {
        EventTypeKey key = EventTypeKey.forEvent(event);
        ensureNotClosed();
        pendingEvents.addLast(new PendingEvent(key, event));
    }

    @Override
    public <E> void enqueue(Class<E> eventType, E event) {
        EventTypeKey key = keyFor(eventType, event);
        ensureNotClosed();
        pendingEvents.addLast(new PendingEvent(key, event));
    }

    @Override
    public int flush() {
        ensureNotClosed();
        if (pendingEvents.isEmpty()) {
            return 0;
        }

        // Only the events queued so far belong to this flush
        List<PendingEvent> batch = new ArrayList<>(pendingEvents);
        pendingEvents.clear();

        int started = 0;
        try {
            for (PendingEvent pending : batch) {
                // A callback closed the bus; the rest of the batch is discarded with it
                if (closed) {
                    LOGGER.debug("Bus closed during flush - dropping {} event(s)", batch.size() - started);
                    break;
                }
                started++;
                totalEventsDispatched++;
                dispatch(pending.getKey(), pending.getEvent(), true);
            }
        } finally {
            if (started < batch.size() && !closed) {
                List<PendingEvent> undelivered = batch.subList(started, batch.size());
                for (int i = undelivered.size() - 1; i >= 0; i--) {
                    pendingEvents.addFirst(undelivered.get(i));
                }
                LOGGER.warn("Flush aborted - {} undelivered event(s) returned to the queue",
                    undelivered.size());
            }
        }
        return batch.size();
    }

    @Override
    public Subscription subscribe() {
        ensureNotClosed();
        return new Subscription(this);
    }

    private void dispatch(EventTypeKey key, Object event, boolean deferred) {
        List<CallbackEntry<?>> callbacks = registry.snapshot(key);
        if (callbacks.isEmpty()) {
            if (handleDeadEvents && !(event instanceof DeadEvent)) {
                deadEventCount++;
                dispatch(DEAD_EVENT_KEY, new DeadEvent(key, event, deferred), deferred);
            }
            return;
        }

        for (CallbackEntry<?> callback : callbacks) {
            // Removed by an earlier callback of this pass
            if (!callback.isActive()) {
                continue;
            }
            invoke(callback, key, event);
        }
    }

    private void invoke(CallbackEntry<?> callback, EventTypeKey key, Object event) {
        // Outside the try: a mismatch is a broken contract, not a subscriber failure
        callback.checkAccepts(event);
        try {
            callback.execute(event);
        } catch (RuntimeException e) {
            subscriberFailureCount++;
            LOGGER.warn("Subscriber {} threw exception while handling event of type {}",
                callback.getSubscriberId(), key, e);
        } catch (Error e) {
            LOGGER.error("Subscriber {} threw Error while handling event of type {}",
                callback.getSubscriberId(), key, e);
            throw e;
        }
    }

    private static <E> EventTypeKey keyFor(Class<E> eventType, E event) {
        Objects.requireNonNull(eventType, "Event type must not be null");
        Objects.requireNonNull(event, "Event must not be null");
        if (!eventType.isInstance(event)) {
            throw new IllegalArgumentException(String.format("Event of type %s is not a %s",
                event.getClass().getName(), eventType.getName()));
        }
        return EventTypeKey.of(eventType);
    }

    // Operations used by Subscription handles

    long nextSubscriberId() {
        return ++lastSubscriberId;
    }

    <E> void addSubscriber(Class<E> eventType, long subscriberId, Consumer<? super E> callback) {
        registry.register(eventType, subscriberId, callback);
    }

    void removeSubscriber(Class<?> eventType, long subscriberId) {
        registry.removeOne(EventTypeKey.of(eventType), subscriberId);
    }

    void removeSubscriber(long subscriberId) {
        registry.removeAll(subscriberId);
    }

    // Metrics and debugging methods

    /**
     * Gets the number of events dispatched, immediately or by a flush. Dead events are not counted.
     *
     * @return the event count
     */
    public long getTotalEventsDispatched() {
        return totalEventsDispatched;
    }

    /**
     * Gets the number of events dispatched while they had no subscribers.
     * Only tracked when dead-event handling is enabled.
     *
     * @return the dead event count
     */
    public long getDeadEventCount() {
        return deadEventCount;
    }

    /**
     * Gets the number of callback invocations that ended in a {@link RuntimeException}.
     *
     * @return the failure count
     */
    public long getSubscriberFailureCount() {
        return subscriberFailureCount;
    }

    /**
     * Gets the number of events waiting for the next flush.
     *
     * @return the pending event count
     */
    public int getPendingEventCount() {
        return pendingEvents.size();
    }

    /**
     * Gets the number of subscribers registered for an event type.
     *
     * @param eventType the event type
     * @return the subscriber count
     */
    public int getSubscriberCount(Class<?> eventType) {
        return registry.getSubscriberCount(EventTypeKey.of(eventType));
    }

    /**
     * Gets the number of (subscriber, event type) registrations across all event types.
     *
     * @return the total subscriber count
     */
    public int getTotalSubscriberCount() {
        return registry.getTotalSubscriberCount();
    }

    /**
     * Gets the number of event types with at least one subscriber.
     *
     * @return the event type count
     */
    public int getRegisteredEventTypeCount() {
        return registry.getEventTypeCount();
    }

    /**
     * Removes all subscribers and discards pending events. Subscription handles bound to
     * this bus become no-ops; further bus operations throw {@link IllegalStateException}.
     */
    @Override
    public void close() {
        if (closed) {
            LOGGER.debug("EventBus already closed");
            return;
        }

        LOGGER.info("Closing EventBus - Events dispatched: {}, Dead events: {}, Subscriber failures: {}",
            totalEventsDispatched, deadEventCount, subscriberFailureCount);

        closed = true;
        int discarded = pendingEvents.size();
        pendingEvents.clear();
        int removedCount = registry.clear();

        if (discarded > 0) {
            LOGGER.warn("Discarded {} pending event(s) on close", discarded);
        }
        LOGGER.info("EventBus closed - Removed {} subscriber registrations", removedCount);
    }

    /**
     * Checks if this EventBus has been closed.
     *
     * @return true if the EventBus has been closed, false otherwise
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Ensures the EventBus is not closed before performing operations.
     *
     * @throws IllegalStateException if the EventBus has been closed
     */
    protected void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("EventBus has been closed");
        }
    }
}
