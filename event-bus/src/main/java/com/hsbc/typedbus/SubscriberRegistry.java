package com.hsbc.typedbus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscriber registry keyed by event type.
 *
 * <p>Each event type maps to its subscriber groups, ordered by the time each subscriber
 * first registered a callback for that type. The registry owns every {@link CallbackEntry};
 * subscription handles only refer to their groups by subscriber id.
 *
 * <p><b>Thread Safety:</b> not thread-safe. The owning bus serializes all access.
 */
final class SubscriberRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final Map<EventTypeKey, List<SubscriberGroup>> groupsByType = new LinkedHashMap<>();

    /**
     * Appends a callback to the group of {@code subscriberId} for {@code eventType},
     * creating the group on first use. Duplicate callbacks are kept and each is invoked.
     *
     * @param eventType the event type to listen for
     * @param subscriberId the owning subscriber
     * @param callback the callback to invoke
     * @param <E> the event type
     */
    <E> void register(Class<E> eventType, long subscriberId, Consumer<? super E> callback) {
        CallbackEntry<E> entry = new CallbackEntry<>(eventType, callback, subscriberId);
        List<SubscriberGroup> groups = groupsByType.computeIfAbsent(
            EventTypeKey.of(eventType), k -> new ArrayList<>());

        SubscriberGroup group = findGroup(groups, subscriberId);
        if (group == null) {
            group = new SubscriberGroup(subscriberId);
            groups.add(group);
        }
        group.add(entry);

        LOGGER.debug("Registered callback #{} of subscriber {} for {}",
            group.size(), subscriberId, eventType.getName());
    }

    /**
     * Removes the group of {@code subscriberId} for one event type. Absent groups are ignored.
     *
     * @param key the event type key
     * @param subscriberId the owning subscriber
     * @return true if a group was removed
     */
    boolean removeOne(EventTypeKey key, long subscriberId) {
        Objects.requireNonNull(key, "Event type key must not be null");
        List<SubscriberGroup> groups = groupsByType.get(key);
        if (groups == null) {
            return false;
        }
        boolean removed = removeGroupsOf(groups, subscriberId) > 0;
        if (groups.isEmpty()) {
            groupsByType.remove(key);
        }
        if (removed) {
            LOGGER.debug("Removed subscriber {} from {}", subscriberId, key);
        }
        return removed;
    }

    /**
     * Removes every group owned by {@code subscriberId}, across all event types.
     * Calling it again for the same subscriber is a no-op.
     *
     * @param subscriberId the owning subscriber
     * @return the number of event types the subscriber was removed from
     */
    int removeAll(long subscriberId) {
        int removed = 0;
        for (Iterator<List<SubscriberGroup>> it = groupsByType.values().iterator(); it.hasNext();) {
            List<SubscriberGroup> groups = it.next();
            removed += removeGroupsOf(groups, subscriberId);
            if (groups.isEmpty()) {
                it.remove();
            }
        }
        if (removed > 0) {
            LOGGER.debug("Removed subscriber {} from {} event type(s)", subscriberId, removed);
        }
        return removed;
    }

    /**
     * Removes all groups of all event types.
     *
     * @return the number of groups removed
     */
    int clear() {
        int removed = 0;
        for (List<SubscriberGroup> groups : groupsByType.values()) {
            for (SubscriberGroup group : groups) {
                group.deactivate();
                removed++;
            }
        }
        groupsByType.clear();
        return removed;
    }

    /**
     * Captures the callbacks registered for an event type in dispatch order: subscriber
     * groups in first-registration order, callbacks within a group in registration order.
     * The returned list is detached from the registry, so callbacks may subscribe or
     * unsubscribe while it is being iterated.
     *
     * @param key the event type key
     * @return the callbacks to invoke, never {@code null}
     */
    List<CallbackEntry<?>> snapshot(EventTypeKey key) {
        List<SubscriberGroup> groups = groupsByType.get(key);
        if (groups == null) {
            return Collections.emptyList();
        }
        List<CallbackEntry<?>> entries = new ArrayList<>();
        for (SubscriberGroup group : groups) {
            entries.addAll(group.getEntries());
        }
        return entries;
    }

    boolean hasSubscribers(EventTypeKey key) {
        return groupsByType.containsKey(key);
    }

    int getSubscriberCount(EventTypeKey key) {
        List<SubscriberGroup> groups = groupsByType.get(key);
        return groups == null ? 0 : groups.size();
    }

    int getTotalSubscriberCount() {
        return groupsByType.values().stream().mapToInt(List::size).sum();
    }

    int getEventTypeCount() {
        return groupsByType.size();
    }

    private static SubscriberGroup findGroup(List<SubscriberGroup> groups, long subscriberId) {
        for (SubscriberGroup group : groups) {
            if (group.getSubscriberId() == subscriberId) {
                return group;
            }
        }
        return null;
    }

    private static int removeGroupsOf(List<SubscriberGroup> groups, long subscriberId) {
        int removed = 0;
        for (Iterator<SubscriberGroup> it = groups.iterator(); it.hasNext();) {
            SubscriberGroup group = it.next();
            if (group.getSubscriberId() == subscriberId) {
                group.deactivate();
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
