package com.hsbc.events;

import java.lang.ref.WeakReference;
import java.util.Objects;

/**
 * Identity-based registry key for a subscriber object.
 *
 * <p>The key holds only a {@link WeakReference} to the subscriber, so it never keeps the
 * subscriber reachable. Two keys are equal when they are the same key instance or when both
 * still resolve to the very same object ({@code ==}, never {@link Object#equals(Object)}).
 * Once the subscriber has been collected its key is equal only to itself, which keeps a
 * stale registry entry reachable for removal by the sweep.
 */
final class SubscriberId {

    private final WeakReference<Object> reference;
    private final int hashCode;

    private SubscriberId(Object subscriber) {
        this.reference = new WeakReference<>(subscriber);
        this.hashCode = System.identityHashCode(subscriber);
    }

    /**
     * Creates the identity key for the given subscriber.
     *
     * @param subscriber the subscriber object
     * @return a new key that does not retain {@code subscriber}
     * @throws NullPointerException if subscriber is null
     */
    static SubscriberId of(Object subscriber) {
        return new SubscriberId(Objects.requireNonNull(subscriber, "Subscriber must not be null"));
    }

    /**
     * Returns the subscriber, or {@code null} once it has been garbage collected.
     */
    Object get() {
        return reference.get();
    }

    /**
     * Checks whether the subscriber is still reachable.
     */
    boolean isAlive() {
        return reference.get() != null;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriberId)) return false;
        SubscriberId that = (SubscriberId) o;
        if (hashCode != that.hashCode) return false;
        Object target = reference.get();
        return target != null && target == that.reference.get();
    }

    @Override
    public String toString() {
        Object target = reference.get();
        String type = target == null ? "<collected>" : target.getClass().getSimpleName();
        return type + "@" + Integer.toHexString(hashCode);
    }
}
