package com.seriesguard.dispatch;

import com.seriesguard.detector.PatternResult;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;

/**
 * Bounded hand-off of detection results from the producing side to downstream consumers.
 *
 * <p>Producers never block: when the queue is full the oldest queued item is dropped to make room.
 * Items are handed out in the order they were enqueued, apart from the dropped ones.
 */
public interface DispatchQueue extends AutoCloseable {

    /**
     * Queues a result for delivery without blocking.
     *
     * @param result the result to deliver
     * @return {@code true} if the result was queued, {@code false} only if the queue is closed
     */
    boolean enqueue(@Nonnull PatternResult result);

    /**
     * Removes the oldest item without waiting.
     */
    Optional<DispatchItem> poll();

    /**
     * Removes the oldest item, waiting up to the given time for one to arrive. Meant for the
     * consumer side only.
     *
     * @return the item, or empty if none arrived in time or the queue was closed while waiting
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<DispatchItem> poll(long timeout, @Nonnull TimeUnit unit) throws InterruptedException;

    /**
     * Removes up to {@code maxItems} items in queue order.
     */
    List<DispatchItem> drain(int maxItems);

    int size();

    int capacity();

    /**
     * Number of items dropped because the queue was full.
     */
    long droppedCount();

    boolean isClosed();

    /**
     * Stops accepting new items and wakes waiting consumers. Items already queued can still be
     * polled.
     */
    @Override
    void close();
}
