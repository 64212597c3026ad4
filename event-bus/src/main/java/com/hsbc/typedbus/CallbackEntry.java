package com.hsbc.typedbus;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Type-erased holder for a callback registered for exactly one event type.
 *
 * <p>The registry stores entries of many event types side by side, so dispatch only sees
 * them through {@link #execute(Object)}. The dispatch path guarantees that the value handed
 * to an entry was found under the entry's own {@link EventTypeKey}; a value of any other
 * type is a broken contract and is rejected before the callback runs.
 *
 * @param <E> the event type this entry accepts
 */
final class CallbackEntry<E> {

    private final Class<E> eventType;
    private final Consumer<? super E> callback;
    private final long subscriberId;
    private boolean active = true;

    CallbackEntry(Class<E> eventType, Consumer<? super E> callback, long subscriberId) {
        this.eventType = Objects.requireNonNull(eventType, "Event type must not be null");
        this.callback = Objects.requireNonNull(callback, "Subscriber callback must not be null");
        this.subscriberId = subscriberId;
    }

    /**
     * Verifies that the given event may be handed to this entry.
     *
     * @param event the dispatched event value
     * @throws EventBusException if the event is not an instance of this entry's type
     */
    void checkAccepts(Object event) {
        if (!eventType.isInstance(event)) {
            throw new EventBusException(String.format(
                "Callback of subscriber %d expects %s but was handed %s",
                subscriberId, eventType.getName(),
                event == null ? "null" : event.getClass().getName()));
        }
    }

    /**
     * Invokes the wrapped callback with the given event.
     *
     * @param event the dispatched event value
     * @throws EventBusException if the event is not an instance of this entry's type
     */
    void execute(Object event) {
        checkAccepts(event);
        callback.accept(eventType.cast(event));
    }

    /**
     * Marks this entry as removed. A dispatch pass that captured the entry before its
     * removal skips it from then on.
     */
    void deactivate() {
        active = false;
    }

    boolean isActive() {
        return active;
    }

    Class<E> getEventType() {
        return eventType;
    }

    long getSubscriberId() {
        return subscriberId;
    }

    @Override
    public String toString() {
        return "CallbackEntry{" +
                "eventType=" + eventType.getName() +
                ", subscriberId=" + subscriberId +
                ", active=" + active +
                '}';
    }
}
