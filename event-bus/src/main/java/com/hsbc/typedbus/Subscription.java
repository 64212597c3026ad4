package com.hsbc.typedbus;

import java.util.Objects;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle for one logical subscriber of a {@link ThreadUnsafeEventBus}.
 *
 * <p>A handle may register callbacks for any number of event types and revoke them one type
 * at a time or all at once. The callbacks themselves live in the bus, indexed by the
 * subscriber id this handle was given at construction.
 *
 * <p>Closing the handle revokes everything it registered, which makes it suitable for
 * try-with-resources or for an owner's own teardown:
 * <pre>{@code
 * try (Subscription subscription = bus.subscribe()) {
 *     subscription
 *         .on(Ping.class, ping -> log(ping))
 *         .on(Pong.class, pong -> log(pong));
 *     ...
 * }
 * }</pre>
 *
 * <p>A handle created without a bus, or whose bus has been closed, ignores every request.
 */
public final class Subscription implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Subscription.class);

    @Nullable
    private final ThreadUnsafeEventBus bus;
    private final long subscriberId;
    private boolean closed = false;

    /**
     * Creates a handle bound to the given bus.
     *
     * @param bus the bus to register with, or {@code null} for a detached handle
     */
    public Subscription(@Nullable ThreadUnsafeEventBus bus) {
        this.bus = bus;
        this.subscriberId = bus == null ? 0 : bus.nextSubscriberId();
    }

    /**
     * Registers a callback for an event type. Registering the same callback twice makes it
     * run twice per event.
     *
     * @param eventType the event type to listen for
     * @param callback the callback to invoke for each event of that type
     * @param <E> the event type
     * @return this handle, for chaining
     * @throws NullPointerException if eventType or callback is null
     * @throws IllegalStateException if this handle has been closed
     */
    public <E> Subscription on(@Nonnull Class<E> eventType, @Nonnull Consumer<? super E> callback) {
        Objects.requireNonNull(eventType, "Event type must not be null");
        Objects.requireNonNull(callback, "Subscriber callback must not be null");
        if (closed) {
            throw new IllegalStateException("Subscription " + subscriberId + " has been closed");
        }
        if (isBound()) {
            bus.addSubscriber(eventType, subscriberId, callback);
        } else {
            LOGGER.debug("Ignoring registration for {} on unbound subscription", eventType.getName());
        }
        return this;
    }

    /**
     * Revokes every callback this handle registered for one event type. Callbacks for other
     * types stay registered. Unknown types are ignored.
     *
     * @param eventType the event type to stop listening for
     * @throws NullPointerException if eventType is null
     */
    public void off(@Nonnull Class<?> eventType) {
        Objects.requireNonNull(eventType, "Event type must not be null");
        if (isBound()) {
            bus.removeSubscriber(eventType, subscriberId);
        }
    }

    /**
     * Revokes every callback this handle registered, for all event types. The handle stays
     * usable. This method is idempotent.
     */
    public void offAll() {
        if (isBound()) {
            bus.removeSubscriber(subscriberId);
        }
    }

    /**
     * Revokes every callback this handle registered and closes it for further registrations.
     * This method is idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        offAll();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Checks whether this handle still talks to a live bus.
     *
     * @return true if bound to a bus that has not been closed
     */
    public boolean isBound() {
        return bus != null && !bus.isClosed();
    }

    /**
     * Gets the subscriber id, unique among the handles of one bus. Detached handles report 0.
     *
     * @return the subscriber id
     */
    public long getSubscriberId() {
        return subscriberId;
    }

    @Override
    public String toString() {
        return "Subscription{" +
                "subscriberId=" + subscriberId +
                ", bound=" + isBound() +
                ", closed=" + closed +
                '}';
    }
}
