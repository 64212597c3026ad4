package com.hsbc.typedbus;

import java.util.Objects;

/**
 * Wraps an event that was dispatched while no subscriber was registered for its type.
 *
 * <p>Only published by buses created with dead-event handling enabled. Subscribing to
 * {@code DeadEvent} is a way to spot producers whose events nobody listens to.
 */
public final class DeadEvent {

    private final EventTypeKey eventType;
    private final Object event;
    private final boolean deferred;

    /**
     * Creates a new DeadEvent.
     *
     * @param eventType the key the event was dispatched under
     * @param event the event that had no subscribers
     * @param deferred true if the event was delivered by a flush rather than emitted directly
     */
    public DeadEvent(EventTypeKey eventType, Object event, boolean deferred) {
        this.eventType = Objects.requireNonNull(eventType, "Event type must not be null");
        this.event = Objects.requireNonNull(event, "Event must not be null");
        this.deferred = deferred;
    }

    public EventTypeKey getEventType() {
        return eventType;
    }

    public Object getEvent() {
        return event;
    }

    public boolean isDeferred() {
        return deferred;
    }

    @Override
    public String toString() {
        return "DeadEvent{" +
                "eventType=" + eventType +
                ", event=" + event +
                ", deferred=" + deferred +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeadEvent deadEvent = (DeadEvent) o;
        return deferred == deadEvent.deferred
                && eventType.equals(deadEvent.eventType)
                && Objects.equals(event, deadEvent.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, event, deferred);
    }
}
