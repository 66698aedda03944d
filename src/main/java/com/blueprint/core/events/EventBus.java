package com.blueprint.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for clarification and breakdown progress.
 * <p>
 * Supports per-idea subscriptions and global subscriptions that receive all events.
 * A subscriber that throws is logged and skipped; it never fails the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-idea subscribers keyed by ideaId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<BlueprintEvent>>> ideaSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<BlueprintEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(BlueprintEvent event) {
        log.debug("Publishing event: {} for idea {}", event.eventType(), event.ideaId());

        List<Consumer<BlueprintEvent>> subs = ideaSubscribers.get(event.ideaId());
        if (subs != null) {
            for (Consumer<BlueprintEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<BlueprintEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific idea.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String ideaId, Consumer<BlueprintEvent> consumer) {
        ideaSubscribers.computeIfAbsent(ideaId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to idea {}", ideaId);
        return () -> {
            CopyOnWriteArrayList<Consumer<BlueprintEvent>> subs = ideaSubscribers.get(ideaId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    ideaSubscribers.remove(ideaId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<BlueprintEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<BlueprintEvent> subscriber, BlueprintEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
