package com.hsbc.typedbus;

/**
 * Producer-facing contract of the event bus.
 *
 * <p>Events are plain value objects of any type; subscribers are keyed by the exact event
 * type they registered for. Two delivery modes are offered:
 * <ul>
 *   <li><b>Immediate:</b> {@link #emitNow(Object)} invokes every matching callback before
 *       returning</li>
 *   <li><b>Deferred:</b> {@link #enqueue(Object)} buffers the event until the caller
 *       drains the buffer with {@link #flush()}</li>
 * </ul>
 *
 * <p>Within one dispatch, subscribers are visited in the order they first registered for
 * the event type, and each subscriber's callbacks run in registration order. No ordering is
 * defined across different event types.
 *
 * <p>Events are handed to every callback as the same instance, so they should be immutable.
 */
public interface EventBus {

    /**
     * Dispatches an event synchronously, keyed by its runtime class.
     *
     * @param event the event to dispatch
     * @param <E> the type of the event
     * @throws NullPointerException if event is null
     */
    <E> void emitNow(E event);

    /**
     * Dispatches an event synchronously, keyed by the given declared type.
     *
     * <p>Use this form to reach subscribers of a supertype or interface of the event's
     * runtime class.
     *
     * @param eventType the type subscribers registered for
     * @param event the event to dispatch
     * @param <E> the type of the event
     * @throws NullPointerException if eventType or event is null
     * @throws IllegalArgumentException if event is not an instance of eventType
     */
    <E> void emitNow(Class<E> eventType, E event);

    /**
     * Buffers an event, keyed by its runtime class, until the next {@link #flush()}.
     *
     * @param event the event to buffer
     * @param <E> the type of the event
     * @throws NullPointerException if event is null
     */
    <E> void enqueue(E event);

    /**
     * Buffers an event, keyed by the given declared type, until the next {@link #flush()}.
     *
     * @param eventType the type subscribers registered for
     * @param event the event to buffer
     * @param <E> the type of the event
     * @throws NullPointerException if eventType or event is null
     * @throws IllegalArgumentException if event is not an instance of eventType
     */
    <E> void enqueue(Class<E> eventType, E event);

    /**
     * Dispatches every event buffered before this call, in FIFO order.
     *
     * <p>Events buffered by callbacks while the flush runs are left for the next flush.
     *
     * @return the number of events drained
     */
    int flush();

    /**
     * Opens a subscription handle bound to this bus.
     *
     * @return a new handle with its own subscriber id
     */
    Subscription subscribe();
}
