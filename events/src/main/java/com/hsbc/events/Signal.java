package com.hsbc.events;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import javax.annotation.Nonnull;

/**
 * An {@link Event} that carries no data.
 *
 * <p>Adds parameterless forms of {@code subscribe}, {@code fire} and {@code fireAndWait};
 * they pass {@link Unit#INSTANCE} to the underlying event. Delivery, ordering and lifecycle
 * rules are those of {@link Event}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Signal reloaded = new Signal("reloaded");
 * reloaded.subscribe(cache, () -> CompletableFuture.runAsync(Cache::invalidateAll));
 * reloaded.fireAndWait();
 * }</pre>
 */
public class Signal extends Event<Unit> {

    /**
     * Creates a signal named {@code "event"} with its own delivery thread pool.
     */
    public Signal() {
        super();
    }

    /**
     * Creates a signal with its own delivery thread pool.
     *
     * @param name a short name for this signal, used in log messages and thread names
     */
    public Signal(@Nonnull String name) {
        super(name);
    }

    /**
     * Creates a signal whose handlers are delivered on the given executor.
     *
     * @param name a short name for this signal, used in log messages
     * @param executor executor running the delivery tasks, not shut down by {@link #close()}
     */
    public Signal(@Nonnull String name, @Nonnull Executor executor) {
        super(name, executor);
    }

    /**
     * Subscribes an object with a handler that takes no argument, replacing any
     * registration the object already has.
     *
     * @param subscriber the subscribing object, held weakly
     * @param handler the handler invoked each time the signal fires
     * @return a handle for the new registration; keeping it is optional
     * @throws NullPointerException if subscriber or handler is null
     * @throws IllegalStateException if this signal has been closed
     */
    public Subscription subscribe(@Nonnull Object subscriber,
                                  @Nonnull Supplier<? extends CompletionStage<Void>> handler) {
        Objects.requireNonNull(handler, "Handler must not be null");
        return subscribe(subscriber, (EventHandler<Unit>) ignored -> handler.get());
    }

    /**
     * Fires the signal without waiting for any handler.
     *
     * @throws IllegalStateException if this signal has been closed
     */
    public void fire() {
        fire(Unit.INSTANCE);
    }

    /**
     * Fires the signal and blocks until every pending delivery has been handled.
     *
     * @throws IllegalStateException if this signal has been closed
     * @throws InterruptedException if interrupted while waiting
     */
    public void fireAndWait() throws InterruptedException {
        fireAndWait(Unit.INSTANCE);
    }
}
