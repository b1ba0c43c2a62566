package com.hsbc.events;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unbounded, strictly ordered queue of values awaiting delivery to one subscriber, together
 * with the task that drains it.
 *
 * <p>At most one drain task exists per queue. It is submitted to the shared executor when a
 * value arrives on an idle queue and it ends when the queue runs empty. For each value the
 * task invokes the handler and waits for the returned stage without occupying a thread: if
 * the stage is still incomplete, the task returns and its continuation resubmits the drain
 * once the stage completes. Handlers that complete synchronously are drained in a loop.
 *
 * <p>After each value has been handled the {@code onHandled} callback runs, which is how
 * the owning registry decrements the pending counter.
 *
 * <p>Handler faults are contained here: a thrown {@link Exception}, checked or not, or an
 * exceptionally completed stage is logged and counted as handled. An {@link Error} is
 * logged, counted as handled and rethrown on the executor thread after the drain has been
 * rescheduled for the remaining values.
 *
 * @param <T> the type of value carried by the event
 */
final class DeliveryQueue<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryQueue.class);

    private static final CompletableFuture<Void> COMPLETED = CompletableFuture.completedFuture(null);

    private final String owner;
    private final EventHandler<? super T> handler;
    private final Executor executor;
    private final Runnable onHandled;

    // guarded by this
    private final Deque<T> values = new ArrayDeque<>();
    private boolean draining = false;
    private boolean cancelled = false;

    /**
     * Creates a queue for one subscriber.
     *
     * @param owner description of the subscriber, used in log messages
     * @param handler the subscriber's handler
     * @param executor executor running the drain task
     * @param onHandled callback run once per handled value
     */
    DeliveryQueue(String owner, EventHandler<? super T> handler, Executor executor, Runnable onHandled) {
        this.owner = Objects.requireNonNull(owner);
        this.handler = Objects.requireNonNull(handler);
        this.executor = Objects.requireNonNull(executor);
        this.onHandled = Objects.requireNonNull(onHandled);
    }

    /**
     * Appends a value to the queue.
     *
     * <p>Does not start the drain task itself, so it can be called while holding a lock the
     * handler must not run under. If this returns true the caller must call {@link #start()}
     * after releasing its locks.
     *
     * @param value the value to deliver
     * @return true if the queue was idle and its drain task must be started
     */
    synchronized boolean enqueue(T value) {
        if (cancelled) {
            return false;
        }
        values.addLast(value);
        if (draining) {
            return false;
        }
        draining = true;
        return true;
    }

    /**
     * Submits the drain task. Only valid after {@link #enqueue(Object)} returned true.
     */
    void start() {
        schedule();
    }

    /**
     * Stops delivery. A handler that is already running finishes; every value still queued
     * is discarded.
     *
     * @return the number of values discarded
     */
    synchronized int cancel() {
        cancelled = true;
        int dropped = values.size();
        values.clear();
        return dropped;
    }

    synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Number of values waiting in the queue, not counting one being handled.
     */
    synchronized int size() {
        return values.size();
    }

    private void schedule() {
        synchronized (this) {
            if (cancelled) {
                draining = false;
                return;
            }
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                draining = false;
            }
            LOGGER.warn("Delivery to subscriber '{}' rejected by executor, {} value(s) left queued",
                owner, size(), e);
        }
    }

    private void drain() {
        while (true) {
            T value;
            synchronized (this) {
                if (cancelled || values.isEmpty()) {
                    draining = false;
                    return;
                }
                value = values.pollFirst();
            }

            CompletableFuture<Void> completion;
            try {
                completion = invoke(value);
            } catch (Error e) {
                LOGGER.error("Subscriber '{}' threw Error while handling value of type {}",
                    owner, value.getClass().getName(), e);
                onHandled.run();
                schedule();
                throw e;
            }

            if (!completion.isDone()) {
                completion.whenComplete((ignored, failure) -> {
                    finish(value, unwrap(failure));
                    schedule();
                });
                return;
            }
            finish(value, failureOf(completion));
        }
    }

    private CompletableFuture<Void> invoke(T value) {
        try {
            CompletionStage<Void> stage = handler.handle(value);
            return stage == null ? COMPLETED : stage.toCompletableFuture();
        } catch (Exception e) {
            // handlers written in other JVM languages may throw undeclared checked exceptions
            return CompletableFuture.failedFuture(e);
        }
    }

    private void finish(T value, Throwable failure) {
        if (failure != null) {
            LOGGER.warn("Subscriber '{}' failed while handling value of type {}",
                owner, value.getClass().getName(), failure);
        }
        onHandled.run();
    }

    private static Throwable failureOf(CompletableFuture<Void> completion) {
        try {
            completion.join();
            return null;
        } catch (CancellationException e) {
            return e;
        } catch (CompletionException e) {
            return unwrap(e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    @Override
    public synchronized String toString() {
        return "DeliveryQueue{" +
                "owner=" + owner +
                ", queued=" + values.size() +
                ", draining=" + draining +
                ", cancelled=" + cancelled +
                '}';
    }
}
