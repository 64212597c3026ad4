package com.hsbc.typedbus;

/**
 * An event waiting in the deferred queue, together with the key it will be dispatched under.
 */
final class PendingEvent {

    private final EventTypeKey key;
    private final Object event;

    PendingEvent(EventTypeKey key, Object event) {
        this.key = key;
        this.event = event;
    }

    EventTypeKey getKey() {
        return key;
    }

    Object getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return "PendingEvent{key=" + key + ", event=" + event + '}';
    }
}
