package com.hsbc.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the per-subscriber queue, driven on the calling thread so that every step is
 * deterministic.
 */
@DisplayName("DeliveryQueue Tests")
class DeliveryQueueTest {

    private final List<String> received = new ArrayList<>();
    private final List<CompletableFuture<Void>> completions = new ArrayList<>();
    private final AtomicInteger handled = new AtomicInteger();

    private DeliveryQueue<String> queue;

    @BeforeEach
    void setUp() {
        received.clear();
        completions.clear();
        handled.set(0);
    }

    private DeliveryQueue<String> newQueue(EventHandler<String> handler, Executor executor) {
        return new DeliveryQueue<>("test-subscriber", handler, executor, handled::incrementAndGet);
    }

    private void offer(String value) {
        if (queue.enqueue(value)) {
            queue.start();
        }
    }

    /** Handler that records the value and returns a stage the test completes by hand. */
    private CompletableFuture<Void> deferred(String value) {
        received.add(value);
        CompletableFuture<Void> completion = new CompletableFuture<>();
        completions.add(completion);
        return completion;
    }

    // ========== Ordering ==========

    @Test
    @DisplayName("Should deliver values in enqueue order")
    void shouldDeliverInOrder() {
        queue = newQueue(EventHandler.of(received::add), TestSupport.DIRECT);

        offer("a");
        offer("b");
        offer("c");

        assertThat(received).containsExactly("a", "b", "c");
        assertThat(handled.get()).isEqualTo(3);
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Should not invoke the handler again before its stage completes")
    void shouldWaitForStageBeforeNextValue() {
        queue = newQueue(this::deferred, TestSupport.DIRECT);

        offer("first");
        offer("second");
        offer("third");

        assertThat(received).containsExactly("first");
        assertThat(queue.size()).isEqualTo(2);
        assertThat(handled.get()).isZero();

        completions.get(0).complete(null);
        assertThat(received).containsExactly("first", "second");
        assertThat(handled.get()).isEqualTo(1);

        completions.get(1).complete(null);
        completions.get(2).complete(null);
        assertThat(received).containsExactly("first", "second", "third");
        assertThat(handled.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Only the first enqueue on an idle queue should request a start")
    void shouldRequestStartOnlyWhenIdle() {
        queue = newQueue(this::deferred, TestSupport.DIRECT);

        assertThat(queue.enqueue("a")).isTrue();
        assertThat(queue.enqueue("b")).isFalse();
        queue.start();
        assertThat(queue.enqueue("c")).isFalse();

        completions.get(0).complete(null);
        completions.get(1).complete(null);
        completions.get(2).complete(null);

        assertThat(received).containsExactly("a", "b", "c");
        assertThat(queue.enqueue("d")).isTrue();
    }

    // ========== Cancellation ==========

    @Test
    @DisplayName("Cancel should discard queued values but let the running handler finish")
    void cancelShouldDropQueuedValues() {
        queue = newQueue(this::deferred, TestSupport.DIRECT);

        offer("running");
        offer("queued-1");
        offer("queued-2");

        assertThat(queue.cancel()).isEqualTo(2);
        assertThat(queue.isCancelled()).isTrue();

        completions.get(0).complete(null);

        assertThat(received).containsExactly("running");
        assertThat(handled.get()).isEqualTo(1);
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Enqueue after cancel should be ignored")
    void enqueueAfterCancelShouldBeIgnored() {
        queue = newQueue(EventHandler.of(received::add), TestSupport.DIRECT);
        queue.cancel();

        assertThat(queue.enqueue("late")).isFalse();
        assertThat(queue.size()).isZero();
        assertThat(received).isEmpty();
    }

    // ========== Handler Faults ==========

    @Test
    @DisplayName("A throwing handler should count as handled and not stop the queue")
    void throwingHandlerShouldNotStopQueue() {
        queue = newQueue(EventHandler.of(value -> {
            if (value.equals("bad")) {
                throw new IllegalStateException("boom");
            }
            received.add(value);
        }), TestSupport.DIRECT);

        assertThatCode(() -> {
            offer("good-1");
            offer("bad");
            offer("good-2");
        }).doesNotThrowAnyException();

        assertThat(received).containsExactly("good-1", "good-2");
        assertThat(handled.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("An undeclared checked exception should count as handled and not stop the queue")
    void undeclaredCheckedExceptionShouldNotStopQueue() {
        queue = newQueue(value -> {
            if (value.equals("bad")) {
                throw TestSupport.<RuntimeException>sneaky(new IOException("disk gone"));
            }
            received.add(value);
            return CompletableFuture.completedFuture(null);
        }, TestSupport.DIRECT);

        assertThatCode(() -> {
            offer("bad");
            offer("good");
        }).doesNotThrowAnyException();

        assertThat(received).containsExactly("good");
        assertThat(handled.get()).isEqualTo(2);
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("An exceptionally completed stage should count as handled")
    void failedStageShouldCountAsHandled() {
        queue = newQueue(this::deferred, TestSupport.DIRECT);

        offer("first");
        offer("second");
        completions.get(0).completeExceptionally(new IllegalArgumentException("failed"));

        assertThat(received).containsExactly("first", "second");
        assertThat(handled.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("A handler returning null should count as completed")
    void nullStageShouldCountAsCompleted() {
        queue = newQueue(value -> {
            received.add(value);
            return null;
        }, TestSupport.DIRECT);

        offer("a");
        offer("b");

        assertThat(received).containsExactly("a", "b");
        assertThat(handled.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("An Error should be rethrown after bookkeeping and leave the queue usable")
    void errorShouldBeRethrownAfterBookkeeping() {
        List<Runnable> tasks = new ArrayList<>();
        queue = newQueue(EventHandler.of(value -> {
            if (value.equals("fatal")) {
                throw new AssertionError("fatal");
            }
            received.add(value);
        }), tasks::add);

        offer("fatal");
        offer("after");
        assertThat(tasks).hasSize(1);

        assertThatThrownBy(() -> tasks.remove(0).run())
            .isInstanceOf(AssertionError.class)
            .hasMessage("fatal");
        assertThat(handled.get()).isEqualTo(1);

        // the drain was rescheduled for the remaining value
        assertThat(tasks).hasSize(1);
        tasks.remove(0).run();
        assertThat(received).containsExactly("after");
        assertThat(handled.get()).isEqualTo(2);
    }

    // ========== Executor ==========

    @Test
    @DisplayName("A rejected start should leave values queued and allow a later restart")
    void rejectedStartShouldAllowRestart() {
        AtomicInteger rejections = new AtomicInteger(1);
        Executor flaky = task -> {
            if (rejections.getAndDecrement() > 0) {
                throw new RejectedExecutionException("shutting down");
            }
            task.run();
        };
        queue = newQueue(EventHandler.of(received::add), flaky);

        offer("first");
        assertThat(received).isEmpty();
        assertThat(queue.size()).isEqualTo(1);

        offer("second");
        assertThat(received).containsExactly("first", "second");
        assertThat(handled.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Each drain should run on the executor, not the enqueuing thread")
    void shouldDrainOnExecutor() {
        List<Runnable> tasks = new ArrayList<>();
        queue = newQueue(EventHandler.of(received::add), tasks::add);

        offer("a");
        offer("b");

        assertThat(received).isEmpty();
        assertThat(tasks).hasSize(1);

        tasks.remove(0).run();
        assertThat(received).containsExactly("a", "b");
        assertThat(tasks).isEmpty();
    }
}
