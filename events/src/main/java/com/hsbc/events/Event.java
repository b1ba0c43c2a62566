package com.hsbc.events;

import java.lang.ref.WeakReference;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A type-safe broadcast of values from one source to any number of subscribers.
 *
 * <p>Subscribers are held through weak references: the event never keeps a subscriber
 * alive, and a subscriber that has been garbage collected is treated as unsubscribed. Its
 * registration is reclaimed lazily, no later than the next {@code subscribe}, {@code fire}
 * or {@code fireAndWait} call. Each subscriber has at most one registration; subscribing
 * again replaces the previous handler and drops the values still queued for it.
 *
 * <p><b>Delivery:</b>
 * <ul>
 *   <li>Every subscriber owns an ordered queue. Values reach a subscriber's handler in
 *       exactly the order they were fired, whichever firing method was used.</li>
 *   <li>A handler is not invoked with the next value before the stage it returned for the
 *       previous value has completed.</li>
 *   <li>Different subscribers are served independently and concurrently, with no ordering
 *       between them. A slow handler only delays its own subscriber.</li>
 * </ul>
 *
 * <p><b>Firing modes:</b>
 * <ul>
 *   <li>{@link #fire(Object)} enqueues and returns without waiting for any handler.</li>
 *   <li>{@link #fireAndWait(Object)} enqueues and then blocks until every pending value,
 *       including values fired earlier, has been handled.</li>
 *   <li>{@link #waitForPendingEvents()} blocks the same way without firing anything.</li>
 * </ul>
 *
 * <p>Handlers that throw or complete exceptionally are logged and do not affect the caller
 * or later deliveries. A handler that never completes stalls its subscriber and every
 * blocking wait; use {@link #waitForPendingEvents(Duration)} where a bound is needed. A
 * handler must not call {@code fireAndWait} on the event that invoked it, since it would
 * wait for its own completion.
 *
 * <p>The handler is held strongly. It must not capture the subscriber, or the subscriber
 * can never be collected; {@link #subscribe(Object, BiFunction)} passes the subscriber to
 * the handler instead.
 *
 * <p>Usage example:
 * <pre>{@code
 * try (Event<String> nameChanged = new Event<>("name-changed")) {
 *     nameChanged.subscribe(view, EventHandler.of(name -> label.setText(name)));
 *     nameChanged.fire("John Doe");
 *     nameChanged.fireAndWait("Jane Doe");
 * }
 * }</pre>
 *
 * <p>This class is safe for concurrent use.
 *
 * @param <T> the type of value carried by the event
 * @see Signal
 */
public class Event<T> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Event.class);

    private static final String DEFAULT_NAME = "event";

    private final String name;
    private final SubscriptionRegistry<T> registry;
    private final ExecutorService ownedExecutor;
    private final AtomicLong totalEventsFired = new AtomicLong(0);

    private volatile boolean closed = false;

    /**
     * Creates an event named {@code "event"} with its own delivery thread pool.
     */
    public Event() {
        this(DEFAULT_NAME);
    }

    /**
     * Creates an event with its own delivery thread pool.
     *
     * @param name a short name for this event, used in log messages and thread names
     */
    public Event(@Nonnull String name) {
        this(name, createDefaultExecutor(name), true);
    }

    /**
     * Creates an event whose handlers are delivered on the given executor. The executor is
     * shared by all subscribers and is not shut down by {@link #close()}.
     *
     * @param name a short name for this event, used in log messages
     * @param executor executor running the delivery tasks
     */
    public Event(@Nonnull String name, @Nonnull Executor executor) {
        this(name, executor, false);
    }

    private Event(String name, Executor executor, boolean ownsExecutor) {
        this.name = Objects.requireNonNull(name, "Name must not be null");
        Objects.requireNonNull(executor, "Executor must not be null");
        this.registry = new SubscriptionRegistry<>(executor);
        this.ownedExecutor = ownsExecutor ? (ExecutorService) executor : null;
    }

    /**
     * Returns the name of this event.
     */
    public String getName() {
        return name;
    }

    /**
     * Subscribes an object to this event, replacing any registration it already has.
     *
     * <p>Values still queued for a replaced handler are dropped, not transferred.
     *
     * @param subscriber the subscribing object, held weakly
     * @param handler the handler invoked for each fired value
     * @return a handle for the new registration; keeping it is optional
     * @throws NullPointerException if subscriber or handler is null
     * @throws IllegalStateException if this event has been closed
     */
    public Subscription subscribe(@Nonnull Object subscriber, @Nonnull EventHandler<? super T> handler) {
        Objects.requireNonNull(subscriber, "Subscriber must not be null");
        Objects.requireNonNull(handler, "Handler must not be null");
        ensureNotClosed();

        registry.sweep();
        Registration<T> registration = registry.register(subscriber, handler);
        LOGGER.debug("Event '{}' subscribed {}", name, registration.id());
        return registration;
    }

    /**
     * Subscribes an object with a handler that receives the subscriber along with each value.
     *
     * <p>The subscriber is resolved from the weak reference at delivery time, so the handler
     * does not need to capture it. Values delivered after the subscriber was collected are
     * skipped.
     *
     * @param subscriber the subscribing object, held weakly
     * @param handler the handler invoked with the subscriber and each fired value
     * @param <S> the type of the subscriber
     * @return a handle for the new registration; keeping it is optional
     * @throws NullPointerException if subscriber or handler is null
     * @throws IllegalStateException if this event has been closed
     */
    public <S> Subscription subscribe(@Nonnull S subscriber,
                                      @Nonnull BiFunction<? super S, ? super T, ? extends CompletionStage<Void>> handler) {
        Objects.requireNonNull(subscriber, "Subscriber must not be null");
        Objects.requireNonNull(handler, "Handler must not be null");
        WeakReference<S> target = new WeakReference<>(subscriber);
        EventHandler<T> bound = value -> {
            S current = target.get();
            if (current == null) {
                return CompletableFuture.completedFuture(null);
            }
            return handler.apply(current, value);
        };
        return subscribe(subscriber, bound);
    }

    /**
     * Removes the subscription of the given object. Has no effect if it is not subscribed.
     *
     * @param subscriber the object to unsubscribe
     * @throws NullPointerException if subscriber is null
     */
    public void unsubscribe(@Nonnull Object subscriber) {
        Objects.requireNonNull(subscriber, "Subscriber must not be null");
        if (registry.deregister(subscriber)) {
            LOGGER.debug("Event '{}' unsubscribed {}@{}", name,
                subscriber.getClass().getSimpleName(), Integer.toHexString(System.identityHashCode(subscriber)));
        }
    }

    /**
     * Fires a value to every live subscriber without waiting for any handler.
     *
     * @param value the value to deliver
     * @throws NullPointerException if value is null
     * @throws IllegalStateException if this event has been closed
     */
    public void fire(@Nonnull T value) {
        Objects.requireNonNull(value, "Value must not be null");
        ensureNotClosed();

        // the registry rejects the value too if close() won the race with the check above
        List<DeliveryQueue<T>> idle = registry.offer(value);
        totalEventsFired.incrementAndGet();
        for (DeliveryQueue<T> queue : idle) {
            queue.start();
        }
        if (registry.size() == 0) {
            LOGGER.debug("Event '{}' fired {} with no subscribers", name, value.getClass().getName());
        }
    }

    /**
     * Fires a value to every live subscriber, then blocks until all pending values,
     * including ones fired before this call, have been handled.
     *
     * @param value the value to deliver
     * @throws NullPointerException if value is null
     * @throws IllegalStateException if this event has been closed
     * @throws InterruptedException if interrupted while waiting
     */
    public void fireAndWait(@Nonnull T value) throws InterruptedException {
        fire(value);
        waitForPendingEvents();
    }

    /**
     * Blocks until every value fired so far has been handled by the subscribers that are
     * still registered.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void waitForPendingEvents() throws InterruptedException {
        registry.awaitIdle();
    }

    /**
     * Blocks until every value fired so far has been handled, or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return true if all pending values were handled, false if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean waitForPendingEvents(@Nonnull Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "Timeout must not be null");
        return registry.awaitIdle(timeout);
    }

    /**
     * Gets the number of subscribers that are still reachable. Reclaims the registrations
     * of collected subscribers as a side effect.
     *
     * @return the live subscriber count
     */
    public int getSubscriberCount() {
        registry.sweep();
        return registry.size();
    }

    /**
     * Gets the number of values enqueued for current subscribers whose handling has not
     * finished yet, summed over all subscribers.
     *
     * @return the pending value count
     */
    public long getPendingEventCount() {
        return registry.pendingCount();
    }

    /**
     * Gets the number of values fired on this event.
     *
     * @return the fired value count
     */
    public long getTotalEventsFired() {
        return totalEventsFired.get();
    }

    /**
     * Removes every subscription and, if this event created its own delivery pool, shuts
     * the pool down. Handlers that are already running finish; queued values are dropped.
     */
    @Override
    public void close() {
        if (closed) {
            LOGGER.debug("Event '{}' already closed", name);
            return;
        }
        closed = true;

        LOGGER.info("Closing event '{}' - Total events fired: {}, Pending: {}, Subscribers: {}",
            name, getTotalEventsFired(), getPendingEventCount(), registry.size());

        int removedCount = registry.clear();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }

        LOGGER.info("Event '{}' closed - Removed {} subscribers", name, removedCount);
    }

    /**
     * Checks if this event has been closed.
     *
     * @return true if closed
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Ensures this event is not closed before accepting new work.
     *
     * @throws IllegalStateException if the event has been closed
     */
    protected void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Event '" + name + "' has been closed");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + "}";
    }

    /**
     * Creates the default delivery pool.
     *
     * @return a daemon cached thread pool whose threads are named {@code <name>-delivery-*}
     */
    private static ExecutorService createDefaultExecutor(String name) {
        Objects.requireNonNull(name, "Name must not be null");
        return Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);
            @Override
            public Thread newThread(@Nonnull Runnable r) {
                Thread t = new Thread(r, name + "-delivery-" + threadNumber.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        });
    }
}
