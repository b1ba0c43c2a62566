package com.hsbc.events;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mapping from subscriber identity to its {@link Registration}, plus the pending-event
 * accounting behind the blocking waits of {@link Event}.
 *
 * <p>The registry instance is the single mutual-exclusion domain for registration state:
 * register, deregister, sweep, enqueue and counter updates all run inside its monitor.
 * Handlers never run inside it. Threads blocked in {@link #awaitIdle()} wait on the same
 * monitor and are notified whenever the tracked pending total drops to zero.
 *
 * <p>Liveness is checked lazily: {@link #sweep()} removes registrations whose subscriber
 * has been garbage collected and is called by the event before every subscribe and fire.
 *
 * @param <T> the type of value carried by the event
 */
final class SubscriptionRegistry<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Executor executor;

    // guarded by this
    private final Map<SubscriberId, Registration<T>> entries = new LinkedHashMap<>();
    private long totalPending = 0;
    private boolean closed = false;

    /**
     * Creates an empty registry.
     *
     * @param executor executor that runs the delivery tasks of every registration
     */
    SubscriptionRegistry(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
    }

    /**
     * Registers a handler for the subscriber. An existing registration for the same
     * subscriber is torn down first and its undelivered values are dropped.
     *
     * @param subscriber the subscriber, held weakly
     * @param handler the handler to invoke for each fired value
     * @return the new registration
     * @throws IllegalStateException if the registry has been cleared for good
     */
    synchronized Registration<T> register(Object subscriber, EventHandler<? super T> handler) {
        ensureOpen();
        SubscriberId id = SubscriberId.of(subscriber);
        Registration<T> previous = entries.remove(id);
        if (previous != null) {
            int dropped = tearDown(previous);
            LOGGER.debug("Replacing subscription for '{}', dropped {} undelivered value(s)", id, dropped);
        }
        Registration<T> registration = new Registration<>(id, handler, executor, this);
        entries.put(id, registration);
        return registration;
    }

    /**
     * Removes the registration of the given subscriber, if any.
     *
     * @param subscriber the subscriber
     * @return true if a registration was removed
     */
    synchronized boolean deregister(Object subscriber) {
        Registration<T> registration = entries.remove(SubscriberId.of(subscriber));
        if (registration == null) {
            return false;
        }
        tearDown(registration);
        return true;
    }

    /**
     * Removes the given registration if it is still the current one for its subscriber.
     *
     * @param registration the registration to remove
     * @return true if it was removed
     */
    synchronized boolean deregister(Registration<T> registration) {
        if (!isCurrent(registration)) {
            return false;
        }
        entries.remove(registration.id());
        tearDown(registration);
        return true;
    }

    synchronized boolean isCurrent(Registration<T> registration) {
        return entries.get(registration.id()) == registration;
    }

    /**
     * Tears down every registration whose subscriber has been garbage collected.
     *
     * @return the number of registrations removed
     */
    synchronized int sweep() {
        int removed = 0;
        Iterator<Registration<T>> it = entries.values().iterator();
        while (it.hasNext()) {
            Registration<T> registration = it.next();
            if (!registration.isSubscriberAlive()) {
                it.remove();
                tearDown(registration);
                removed++;
            }
        }
        if (removed > 0) {
            LOGGER.debug("Swept {} registration(s) of collected subscribers", removed);
        }
        return removed;
    }

    /**
     * Returns a snapshot of the registrations whose subscriber is still reachable. A
     * subscriber collected since the last sweep is left out even before it is swept.
     */
    synchronized List<Registration<T>> activeEntries() {
        List<Registration<T>> active = new ArrayList<>(entries.size());
        for (Registration<T> registration : entries.values()) {
            if (registration.isSubscriberAlive()) {
                active.add(registration);
            }
        }
        return Collections.unmodifiableList(active);
    }

    /**
     * Sweeps, then enqueues the value for every live registration and counts it as pending.
     *
     * <p>The returned queues were idle and must be started by the caller once it is outside
     * this monitor, see {@link DeliveryQueue#enqueue(Object)}.
     *
     * @param value the value to deliver
     * @return the queues whose drain task has to be started
     * @throws IllegalStateException if the registry has been cleared for good
     */
    synchronized List<DeliveryQueue<T>> offer(T value) {
        ensureOpen();
        sweep();
        if (entries.isEmpty()) {
            return Collections.emptyList();
        }
        List<DeliveryQueue<T>> toStart = new ArrayList<>();
        for (Registration<T> registration : activeEntries()) {
            if (registration.queue().enqueue(value)) {
                toStart.add(registration.queue());
            }
            registration.pending().increment();
            totalPending++;
        }
        return toStart;
    }

    /**
     * Records that one value of the registration has been handled. Ignored for a
     * registration that has been torn down, since its counter is no longer tracked.
     */
    synchronized void markHandled(Registration<T> registration) {
        if (!isCurrent(registration)) {
            return;
        }
        if (registration.pending().decrement()) {
            totalPending--;
            if (totalPending == 0) {
                notifyAll();
            }
        }
    }

    /**
     * Blocks until every tracked pending counter is zero.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    synchronized void awaitIdle() throws InterruptedException {
        while (totalPending > 0) {
            wait();
        }
    }

    /**
     * Blocks until every tracked pending counter is zero or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return true if idle, false if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    synchronized boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        long deadline = System.nanoTime() + remaining;
        while (totalPending > 0) {
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
            remaining = deadline - System.nanoTime();
        }
        return true;
    }

    /**
     * Tears down every registration and closes the registry: later calls to
     * {@link #register} and {@link #offer} throw {@link IllegalStateException}. Safe to call
     * more than once.
     *
     * @return the number of registrations removed
     */
    synchronized int clear() {
        closed = true;
        int count = entries.size();
        for (Registration<T> registration : entries.values()) {
            tearDown(registration);
        }
        entries.clear();
        return count;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Subscriptions have been closed");
        }
    }

    /**
     * Number of registrations, including ones whose subscriber was collected but not swept.
     */
    synchronized int size() {
        return entries.size();
    }

    /**
     * Sum of all tracked pending counters.
     */
    synchronized long pendingCount() {
        return totalPending;
    }

    // Caller holds the monitor and has already removed the entry from the map.
    private int tearDown(Registration<T> registration) {
        int dropped = registration.queue().cancel();
        totalPending -= registration.pending().get();
        if (totalPending == 0) {
            notifyAll();
        }
        return dropped;
    }
}
