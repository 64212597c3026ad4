package com.hsbc.typedbus;

/**
 * Thrown when the event bus detects a broken internal contract, such as an event
 * being handed to a callback registered for a different event type.
 */
public class EventBusException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventBusException(String message) {
        super(message);
    }
}
