package com.hsbc.typedbus;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Subscription Tests")
class SubscriptionTest {

    static class Ping {
        final int n;
        Ping(int n) { this.n = n; }
    }

    static class Pong {
    }

    private ThreadUnsafeEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new ThreadUnsafeEventBus();
    }

    @Test
    @DisplayName("Should deliver to both subscribers and only to the remaining one after offAll")
    void shouldDeliverPingToRemainingSubscriberAfterOffAll() {
        List<String> calls = new ArrayList<>();
        Subscription a = new Subscription(bus);
        Subscription b = new Subscription(bus);
        a.on(Ping.class, ping -> calls.add("cb1:" + ping.n));
        b.on(Ping.class, ping -> calls.add("cb2:" + ping.n));

        bus.emitNow(new Ping(5));
        assertThat(calls).containsExactly("cb1:5", "cb2:5");

        a.offAll();
        bus.emitNow(new Ping(7));
        assertThat(calls).containsExactly("cb1:5", "cb2:5", "cb2:7");
    }

    @Test
    @DisplayName("Should silence every type after offAll")
    void shouldSilenceEveryTypeAfterOffAll() {
        AtomicInteger received = new AtomicInteger();
        Subscription subscription = bus.subscribe();
        subscription.on(Ping.class, p -> received.incrementAndGet());
        subscription.on(Pong.class, p -> received.incrementAndGet());

        subscription.offAll();
        bus.emitNow(new Ping(1));
        bus.enqueue(new Pong());
        bus.flush();

        assertEquals(0, received.get());
        assertEquals(0, bus.getRegisteredEventTypeCount());
    }

    @Test
    @DisplayName("Should remain usable after offAll")
    void shouldRemainUsableAfterOffAll() {
        AtomicInteger received = new AtomicInteger();
        Subscription subscription = bus.subscribe();
        subscription.on(Ping.class, p -> received.incrementAndGet());
        subscription.offAll();
        subscription.offAll(); // idempotent

        subscription.on(Ping.class, p -> received.incrementAndGet());
        bus.emitNow(new Ping(1));

        assertEquals(1, received.get());
    }

    @Test
    @DisplayName("Should remove only the given type on off")
    void shouldRemoveOnlyGivenType() {
        List<String> calls = new ArrayList<>();
        Subscription subscription = bus.subscribe();
        subscription.on(Ping.class, p -> calls.add("ping"));
        subscription.on(Ping.class, p -> calls.add("ping-again"));
        subscription.on(Pong.class, p -> calls.add("pong"));

        subscription.off(Ping.class);
        bus.emitNow(new Ping(1));
        bus.emitNow(new Pong());

        assertThat(calls).containsExactly("pong");
        assertEquals(0, bus.getSubscriberCount(Ping.class));
        assertEquals(1, bus.getSubscriberCount(Pong.class));
    }

    @Test
    @DisplayName("Should leave other subscribers of the type alone on off")
    void shouldLeaveOtherSubscribersAloneOnOff() {
        List<String> calls = new ArrayList<>();
        Subscription a = bus.subscribe();
        Subscription b = bus.subscribe();
        a.on(Ping.class, p -> calls.add("a"));
        b.on(Ping.class, p -> calls.add("b"));

        a.off(Ping.class);
        a.off(Ping.class);
        a.off(Pong.class);
        bus.emitNow(new Ping(1));

        assertThat(calls).containsExactly("b");
    }

    @Test
    @DisplayName("Should unsubscribe everything when closed by try-with-resources")
    void shouldUnsubscribeOnClose() {
        AtomicInteger received = new AtomicInteger();
        Subscription escaped;
        try (Subscription subscription = bus.subscribe()) {
            subscription.on(Ping.class, p -> received.incrementAndGet());
            bus.emitNow(new Ping(1));
            escaped = subscription;
        }

        bus.emitNow(new Ping(2));

        assertEquals(1, received.get());
        assertTrue(escaped.isClosed());
        assertDoesNotThrow(escaped::close);
        assertDoesNotThrow(escaped::offAll);
    }

    @Test
    @DisplayName("Should reject registrations on a closed handle")
    void shouldRejectRegistrationsWhenClosed() {
        Subscription subscription = bus.subscribe();
        subscription.close();

        assertThatThrownBy(() -> subscription.on(Ping.class, p -> {}))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("has been closed");
        assertEquals(0, bus.getTotalSubscriberCount());
    }

    @Test
    @DisplayName("Should ignore every request without a bus")
    void shouldIgnoreRequestsWithoutBus() {
        Subscription detached = new Subscription(null);

        assertFalse(detached.isBound());
        assertEquals(0, detached.getSubscriberId());
        assertDoesNotThrow(() -> {
            detached.on(Ping.class, p -> {
                throw new AssertionError("never dispatched");
            });
            detached.off(Ping.class);
            detached.offAll();
            detached.close();
        });
    }

    @Test
    @DisplayName("Should ignore every request once the bus is closed")
    void shouldIgnoreRequestsAfterBusClosed() {
        Subscription subscription = bus.subscribe();
        subscription.on(Ping.class, p -> {});
        bus.close();

        assertFalse(subscription.isBound());
        assertDoesNotThrow(() -> {
            subscription.on(Pong.class, p -> {});
            subscription.off(Ping.class);
            subscription.offAll();
            subscription.close();
        });
        assertEquals(0, bus.getTotalSubscriberCount());
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNullArguments() {
        Subscription subscription = bus.subscribe();

        assertThatThrownBy(() -> subscription.on(null, p -> {}))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("Event type must not be null");
        assertThatThrownBy(() -> subscription.on(Ping.class, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("Subscriber callback must not be null");
        assertThrows(NullPointerException.class, () -> subscription.off(null));
    }

    @Test
    @DisplayName("Should assign increasing subscriber ids")
    void shouldAssignIncreasingIds() {
        Subscription first = new Subscription(bus);
        Subscription second = bus.subscribe();

        assertThat(second.getSubscriberId()).isGreaterThan(first.getSubscriberId());
        assertThat(first.toString()).contains("subscriberId=" + first.getSubscriberId());
    }
}
