package com.seriesguard.dispatch;

/**
 * Represents a registration with a {@link DeliveryWorker} that can be cancelled.
 */
public interface Subscription {

    /**
     * Cancels this subscription. Items taken off the queue afterwards are no longer delivered to
     * the subscriber.
     *
     * <p>This method is idempotent.
     */
    void unsubscribe();

    /**
     * @return true if the subscription is active, false if it has been unsubscribed
     */
    boolean isActive();
}
