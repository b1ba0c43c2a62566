package com.hsbc.events;

/**
 * Handle for a single registration on an {@link Event}.
 *
 * <p>Keeping the handle is optional: the event holds its subscribers weakly and drops the
 * registration once the subscriber is garbage collected.
 */
public interface Subscription {

    /**
     * Cancels this registration. Values still queued for it are discarded.
     *
     * <p>This method is idempotent. It has no effect once the registration has been replaced
     * by a later {@code subscribe} for the same subscriber, so a stale handle never removes
     * its replacement.
     */
    void unsubscribe();

    /**
     * Checks if this registration is still the current one for its subscriber and the
     * subscriber has not been garbage collected.
     *
     * @return true if values fired from now on would be delivered through this registration
     */
    boolean isActive();
}
