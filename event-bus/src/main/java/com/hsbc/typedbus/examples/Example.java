package com.hsbc.typedbus.examples;

import com.hsbc.typedbus.DeadEvent;
import com.hsbc.typedbus.Subscription;
import com.hsbc.typedbus.ThreadUnsafeEventBus;

/**
 * Compact demonstrations of immediate and deferred delivery.
 */
public final class Example {

    private static final class Ping {
        final int n;
        Ping(int n) { this.n = n; }
    }

    private static final class Tick {
        final long frame;
        Tick(long frame) { this.frame = frame; }
    }

    private Example() {
        // utility class
    }

    public static void main(String[] args) {
        System.out.println("=== Immediate delivery ===");
        demoImmediateDelivery();

        System.out.println();
        System.out.println("=== Deferred delivery ===");
        demoDeferredDelivery();

        System.out.println();
        System.out.println("=== Dead events ===");
        demoDeadEvents();
    }

    private static void demoImmediateDelivery() {
        try (ThreadUnsafeEventBus bus = new ThreadUnsafeEventBus()) {
            Subscription a = bus.subscribe();
            Subscription b = bus.subscribe();

            a.on(Ping.class, ping -> System.out.println("A received ping " + ping.n));
            b.on(Ping.class, ping -> System.out.println("B received ping " + ping.n));

            bus.emitNow(new Ping(5));

            a.offAll();
            bus.emitNow(new Ping(7));
            b.close();
        }
    }

    private static void demoDeferredDelivery() {
        try (ThreadUnsafeEventBus bus = new ThreadUnsafeEventBus();
             Subscription renderer = bus.subscribe()) {

            renderer.on(Tick.class, tick -> {
                System.out.println("Rendering frame " + tick.frame);
                if (tick.frame < 3) {
                    // picked up by the next flush, not this one
                    bus.enqueue(new Tick(tick.frame + 1));
                }
            });

            bus.enqueue(new Tick(1));
            int frame = 0;
            while (bus.getPendingEventCount() > 0) {
                frame++;
                System.out.println("Flush " + frame + " drained " + bus.flush() + " event(s)");
            }
        }
    }

    private static void demoDeadEvents() {
        try (ThreadUnsafeEventBus bus = new ThreadUnsafeEventBus(true);
             Subscription monitor = bus.subscribe()) {

            monitor.on(DeadEvent.class, dead ->
                System.out.println("Nobody listens to " + dead.getEventType()));

            bus.emitNow(new Ping(1));
            bus.enqueue(new Tick(1));
            bus.flush();

            System.out.println("Dead events: " + bus.getDeadEventCount());
        }
    }
}
