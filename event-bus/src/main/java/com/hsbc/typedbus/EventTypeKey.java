package com.hsbc.typedbus;

import java.util.Objects;

/**
 * Identity of an event type, used to index subscribers in the registry.
 *
 * <p>A key is derived from a {@link Class}: two events of the same declared type always
 * yield equal keys and different types never collide. Keys are only ever compared and
 * hashed, never dereferenced into the events they describe.
 */
public final class EventTypeKey {

    private final Class<?> eventType;

    private EventTypeKey(Class<?> eventType) {
        this.eventType = eventType;
    }

    /**
     * Creates the key for the given event type.
     *
     * @param eventType the declared event type
     * @return the key for {@code eventType}
     * @throws NullPointerException if eventType is null
     */
    public static EventTypeKey of(Class<?> eventType) {
        return new EventTypeKey(Objects.requireNonNull(eventType, "Event type must not be null"));
    }

    /**
     * Creates the key for the runtime class of the given event. Enum constants are keyed by
     * their enum type, including constants declared with a body.
     *
     * @param event the event value
     * @return the key for the event's type
     * @throws NullPointerException if event is null
     */
    public static EventTypeKey forEvent(Object event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (event instanceof Enum<?>) {
            return of(((Enum<?>) event).getDeclaringClass());
        }
        return of(event.getClass());
    }

    public Class<?> getEventType() {
        return eventType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventTypeKey)) return false;
        return eventType == ((EventTypeKey) o).eventType;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(eventType);
    }

    @Override
    public String toString() {
        return eventType.getName();
    }
}
