package com.hsbc.typedbus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The callbacks one subscriber registered for one event type, in registration order.
 */
final class SubscriberGroup {

    private final long subscriberId;
    private final List<CallbackEntry<?>> entries = new ArrayList<>();

    SubscriberGroup(long subscriberId) {
        this.subscriberId = subscriberId;
    }

    long getSubscriberId() {
        return subscriberId;
    }

    void add(CallbackEntry<?> entry) {
        entries.add(entry);
    }

    List<CallbackEntry<?>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    int size() {
        return entries.size();
    }

    /**
     * Deactivates every entry of this group; called when the group leaves the registry.
     */
    void deactivate() {
        entries.forEach(CallbackEntry::deactivate);
    }
}
