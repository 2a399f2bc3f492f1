package com.seriesguard.dispatch;

import com.seriesguard.detector.PatternResult;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe {@link DispatchQueue} backed by an {@link ArrayDeque} guarded by one lock.
 *
 * <p>When an item arrives at a full queue, the head is removed and counted as dropped before the
 * new item is appended, so the queue never holds more than {@code capacity} items and the newest
 * results are the ones that survive. Consumers waiting in {@link #poll(long, TimeUnit)} are
 * signalled on every enqueue and on close.
 */
public class DropOldestDispatchQueue implements DispatchQueue {

    private static final Logger log = LoggerFactory.getLogger(DropOldestDispatchQueue.class);

    private final int capacity;
    private final Clock clock;
    private final ArrayDeque<DispatchItem> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    public DropOldestDispatchQueue(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    /**
     * @param capacity maximum number of queued items
     * @param clock the clock used to stamp queued items
     * @throws IllegalArgumentException if capacity is not positive
     */
    public DropOldestDispatchQueue(int capacity, @Nonnull Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.items = new ArrayDeque<>(capacity);
    }

    @Override
    public boolean enqueue(@Nonnull PatternResult result) {
        Objects.requireNonNull(result, "result");
        DispatchItem item = new DispatchItem(result, clock.instant());
        DispatchItem evicted = null;
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (items.size() == capacity) {
                evicted = items.pollFirst();
                dropped.incrementAndGet();
            }
            items.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
        if (evicted != null) {
            log.warn("Dispatch queue full, dropped result for series '{}' ({} dropped so far)",
                    evicted.getSeriesKey(), dropped.get());
        }
        return true;
    }

    @Override
    public Optional<DispatchItem> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<DispatchItem> poll(long timeout, @Nonnull TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(unit, "unit");
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (closed || nanos <= 0L) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return Optional.of(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<DispatchItem> drain(int maxItems) {
        if (maxItems < 0) {
            throw new IllegalArgumentException("maxItems must not be negative");
        }
        lock.lock();
        try {
            int n = Math.min(maxItems, items.size());
            List<DispatchItem> batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                batch.add(items.pollFirst());
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Dispatch queue closed with {} pending items", size());
    }
}
