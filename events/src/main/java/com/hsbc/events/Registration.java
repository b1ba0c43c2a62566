package com.hsbc.events;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * One subscriber's registration: its identity, handler, delivery queue and pending counter.
 *
 * <p>The counter is only touched inside the owning registry's monitor.
 *
 * @param <T> the type of value carried by the event
 */
final class Registration<T> implements Subscription {

    private final SubscriberId id;
    private final SubscriptionRegistry<T> registry;
    private final PendingCounter pending = new PendingCounter();
    private final DeliveryQueue<T> queue;

    Registration(SubscriberId id, EventHandler<? super T> handler, Executor executor,
                 SubscriptionRegistry<T> registry) {
        this.id = Objects.requireNonNull(id);
        this.registry = Objects.requireNonNull(registry);
        this.queue = new DeliveryQueue<>(id.toString(), handler, executor, () -> registry.markHandled(this));
    }

    SubscriberId id() {
        return id;
    }

    PendingCounter pending() {
        return pending;
    }

    DeliveryQueue<T> queue() {
        return queue;
    }

    boolean isSubscriberAlive() {
        return id.isAlive();
    }

    @Override
    public void unsubscribe() {
        registry.deregister(this);
    }

    @Override
    public boolean isActive() {
        return isSubscriberAlive() && registry.isCurrent(this);
    }

    @Override
    public String toString() {
        return "Registration{" +
                "subscriber=" + id +
                ", queue=" + queue +
                '}';
    }
}
