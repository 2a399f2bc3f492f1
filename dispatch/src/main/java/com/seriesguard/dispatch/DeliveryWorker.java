package com.seriesguard.dispatch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a {@link DispatchQueue} on a single daemon thread and hands every item to the registered
 * subscribers.
 * <p>
 * Subscribers are invoked on the delivery thread in registration order. A subscriber that throws a
 * {@link RuntimeException} is logged and counted; the remaining subscribers still receive the item
 * and the worker keeps running. Delivery is best effort: an item is handed to each subscriber that
 * was active when the item was taken off the queue, at most once, and is not retried.
 * </p>
 * <p>
 * Subscriber registration uses a {@link CopyOnWriteArrayList}, so subscribing and unsubscribing are
 * safe from any thread while delivery is running.
 * </p>
 */
public class DeliveryWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeliveryWorker.class);
    private static final long POLL_TIMEOUT_MS = 100;
    private static final long TERMINATION_TIMEOUT_MS = 5_000;

    private final DispatchQueue queue;
    private final List<SubscriberWrapper> subscribers = new CopyOnWriteArrayList<>();
    private final ExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public DeliveryWorker(@Nonnull DispatchQueue queue) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "series-guard-delivery");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Registers a subscriber receiving every item.
     */
    public Subscription subscribe(@Nonnull String name, @Nonnull Consumer<DispatchItem> callback) {
        return subscribe(name, callback, null);
    }

    /**
     * Registers a subscriber receiving the items accepted by {@code filter}.
     *
     * @param name identifies the subscriber in logs
     * @param callback receives the items
     * @param filter selects the items, or {@code null} for all of them
     * @return a handle cancelling the registration
     */
    public Subscription subscribe(@Nonnull String name, @Nonnull Consumer<DispatchItem> callback,
                                  @Nullable Predicate<DispatchItem> filter) {
        SubscriberWrapper wrapper = new SubscriberWrapper(
                Objects.requireNonNull(name, "name"), Objects.requireNonNull(callback, "callback"), filter);
        subscribers.add(wrapper);
        return wrapper;
    }

    /**
     * Starts the delivery thread. Calling it again has no effect.
     *
     * @throws IllegalStateException if the worker has been closed
     */
    public void start() {
        if (executor.isShutdown()) {
            throw new IllegalStateException("Delivery worker is closed");
        }
        if (started.compareAndSet(false, true)) {
            running.set(true);
            executor.execute(this::runLoop);
            log.info("Delivery worker started");
        }
    }

    private void runLoop() {
        while (running.get()) {
            Optional<DispatchItem> next;
            try {
                next = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (next.isPresent()) {
                deliver(next.get());
            } else if (queue.isClosed() && queue.size() == 0) {
                break;
            }
        }
        log.info("Delivery worker stopped after {} deliveries ({} failed)", delivered.get(), failures.get());
    }

    /**
     * Hands one item to every active subscriber on the calling thread.
     */
    void deliver(DispatchItem item) {
        for (SubscriberWrapper subscriber : subscribers) {
            subscriber.invoke(item);
        }
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    /**
     * Number of subscriber invocations that ended with a {@link RuntimeException}.
     */
    public long getFailureCount() {
        return failures.get();
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    /**
     * Stops the delivery thread, waiting up to {@link #TERMINATION_TIMEOUT_MS} milliseconds for the
     * current delivery to finish. Items still queued are left in the queue.
     */
    @Override
    public void close() {
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private final class SubscriberWrapper implements Subscription {
        private final String name;
        private final Consumer<DispatchItem> callback;
        private final Predicate<DispatchItem> filter;
        private volatile boolean active = true;

        SubscriberWrapper(String name, Consumer<DispatchItem> callback, Predicate<DispatchItem> filter) {
            this.name = name;
            this.callback = callback;
            this.filter = filter;
        }

        void invoke(DispatchItem item) {
            if (!active) {
                return;
            }
            try {
                if (filter == null || filter.test(item)) {
                    callback.accept(item);
                    delivered.incrementAndGet();
                }
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                log.warn("Subscriber '{}' failed to handle result for series '{}'", name, item.getSeriesKey(), e);
            }
        }

        @Override
        public void unsubscribe() {
            if (active) {
                active = false;
                subscribers.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
