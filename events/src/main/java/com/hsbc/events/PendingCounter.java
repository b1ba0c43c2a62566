package com.hsbc.events;

/**
 * Number of values enqueued for one subscriber whose handling has not finished yet.
 *
 * <p>Not thread-safe: every access happens inside the {@link SubscriptionRegistry} monitor.
 */
final class PendingCounter {

    private int count;

    void increment() {
        count++;
    }

    /**
     * Decrements the count, never going below zero.
     *
     * @return false if the count was already zero
     */
    boolean decrement() {
        if (count == 0) {
            return false;
        }
        count--;
        return true;
    }

    int get() {
        return count;
    }

    @Override
    public String toString() {
        return Integer.toString(count);
    }
}
