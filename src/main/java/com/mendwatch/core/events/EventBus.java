package com.mendwatch.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process pub/sub for engine events.
 * <p>
 * Every subscription is a filter plus a callback. Events are delivered synchronously on the
 * publishing thread, in subscription order, to each subscriber whose filter accepts them. A
 * subscriber that throws is logged and skipped.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Delivers {@code event} to every matching subscriber.
     *
     * @return the number of subscribers that received it
     */
    public int publish(MendwatchEvent event) {
        int delivered = 0;
        for (Subscriber subscriber : subscribers) {
            if (subscriber.accepts(event)) {
                deliverSafely(subscriber, event);
                delivered++;
            }
        }
        log.debug("Published {} from {} to {} subscriber(s)", event.eventType(), event.source(), delivered);
        return delivered;
    }

    /** Events whose type is exactly {@code eventType}. */
    public Subscription subscribe(String eventType, Consumer<MendwatchEvent> consumer) {
        return subscribe("type=" + eventType, e -> e.eventType().equals(eventType), consumer);
    }

    /**
     * Events in any of the given categories, the part of the type before the first dot
     * ({@code task}, {@code error}, {@code agent}, {@code scan}).
     */
    public Subscription subscribeCategories(Collection<String> categories, Consumer<MendwatchEvent> consumer) {
        Set<String> wanted = Set.copyOf(categories);
        return subscribe("categories=" + wanted, e -> wanted.contains(e.category()), consumer);
    }

    public Subscription subscribeAll(Consumer<MendwatchEvent> consumer) {
        return subscribe("all", e -> true, consumer);
    }

    /**
     * Events accepted by {@code filter}. The filter runs on the publishing thread and must not
     * block.
     */
    public Subscription subscribe(String description, Predicate<MendwatchEvent> filter,
                                  Consumer<MendwatchEvent> consumer) {
        var subscriber = new Subscriber(description, filter, consumer);
        subscribers.add(subscriber);
        log.debug("Subscribed to {}", description);
        return () -> {
            if (subscribers.remove(subscriber)) {
                log.debug("Unsubscribed from {}", description);
            }
        };
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for cancelling a subscription. Cancelling twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Subscriber subscriber, MendwatchEvent event) {
        try {
            subscriber.consumer().accept(event);
        } catch (Exception e) {
            log.warn("Subscriber [{}] failed on {}: {}", subscriber.description(), event.eventType(), e.getMessage(), e);
        }
    }

    private record Subscriber(String description, Predicate<MendwatchEvent> filter,
                              Consumer<MendwatchEvent> consumer) {

        boolean accepts(MendwatchEvent event) {
            try {
                return filter.test(event);
            } catch (RuntimeException e) {
                log.warn("Filter for [{}] failed on {}: {}", description, event.eventType(), e.getMessage());
                return false;
            }
        }
    }
}
