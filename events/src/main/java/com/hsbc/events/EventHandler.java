package com.hsbc.events;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Asynchronous handler invoked with each value fired on an {@link Event}.
 *
 * <p>The handler signals that it has finished with a value by completing the returned
 * stage. The next value for the same subscriber is not delivered before that happens, and
 * {@link Event#fireAndWait(Object)} does not return before it happens. A handler that
 * returns {@code null} is treated as finished.
 *
 * <p>Usage example:
 * <pre>{@code
 * Event<String> nameChanged = new Event<>("name-changed");
 * nameChanged.subscribe(view, name -> mailer.sendAsync(name));
 * nameChanged.subscribe(audit, EventHandler.of(name -> audit.record(name)));
 * }</pre>
 *
 * @param <T> the type of value carried by the event
 */
@FunctionalInterface
public interface EventHandler<T> {

    /**
     * Handles a fired value.
     *
     * @param value the value that was fired, never null
     * @return a stage that completes once the value has been handled
     */
    CompletionStage<Void> handle(T value);

    /**
     * Adapts a synchronous consumer. The returned handler runs the consumer on the delivery
     * thread and reports completion as soon as the consumer returns.
     *
     * @param consumer the consumer to adapt
     * @param <T> the type of value carried by the event
     * @return a handler that completes immediately after {@code consumer} returns
     * @throws NullPointerException if consumer is null
     */
    static <T> EventHandler<T> of(Consumer<? super T> consumer) {
        Objects.requireNonNull(consumer, "Consumer must not be null");
        return value -> {
            consumer.accept(value);
            return CompletableFuture.completedFuture(null);
        };
    }
}
