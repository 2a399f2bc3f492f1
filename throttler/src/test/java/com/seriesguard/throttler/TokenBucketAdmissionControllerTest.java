package com.seriesguard.throttler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TokenBucketAdmissionControllerTest {

    private static final Duration IDLE = Duration.ofMinutes(1);

    private MutableClock clock;
    private TokenBucketAdmissionController controller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(10_000L);
        Map<OperationKind, RateLimit> limits = new EnumMap<>(OperationKind.class);
        limits.put(OperationKind.INGEST, new RateLimit(5, 1.0));
        limits.put(OperationKind.QUERY, new RateLimit(2, 0.5));
        controller = new TokenBucketAdmissionController(limits, IDLE, clock);
    }

    @Test
    void shouldRejectInvalidLimits() {
        assertThatThrownBy(() -> new RateLimit(0, 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
        assertThatThrownBy(() -> new RateLimit(1, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("refillPerSecond");
        assertThatThrownBy(() -> new RateLimit(1, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("refillPerSecond");
        assertThatThrownBy(() -> new TokenBucketAdmissionController(new EnumMap<>(OperationKind.class), Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("idleTimeout");
    }

    @Test
    @DisplayName("Burst up to capacity, then one token per second")
    void burstThenRefill() {
        for (int i = 0; i < 5; i++) {
            assertThat(controller.allow("client-a", OperationKind.INGEST)).isTrue();
        }
        assertThat(controller.allow("client-a", OperationKind.INGEST)).isFalse();

        clock.advance(Duration.ofSeconds(1));

        assertThat(controller.allow("client-a", OperationKind.INGEST)).isTrue();
        assertThat(controller.allow("client-a", OperationKind.INGEST)).isFalse();
    }

    @Test
    void partialRefillDoesNotAdmit() {
        for (int i = 0; i < 5; i++) {
            controller.allow("c", OperationKind.INGEST);
        }
        clock.advance(Duration.ofMillis(999));

        assertThat(controller.allow("c", OperationKind.INGEST)).isFalse();
        assertThat(controller.availableTokens("c", OperationKind.INGEST)).isCloseTo(0.999, offset(1e-9));
    }

    @Test
    @DisplayName("Tokens never exceed the capacity after a long pause")
    void refillIsCappedAtCapacity() {
        controller.allow("c", OperationKind.INGEST);
        clock.advance(Duration.ofHours(1));

        assertThat(controller.availableTokens("c", OperationKind.INGEST)).isEqualTo(5.0);
        int admitted = 0;
        for (int i = 0; i < 10; i++) {
            if (controller.allow("c", OperationKind.INGEST)) {
                admitted++;
            }
        }
        assertThat(admitted).isEqualTo(5);
    }

    @Test
    @DisplayName("A clock stepping backwards adds no tokens")
    void backwardsClockAddsNothing() {
        for (int i = 0; i < 5; i++) {
            controller.allow("c", OperationKind.INGEST);
        }
        clock.advance(Duration.ofSeconds(-30));
        assertThat(controller.allow("c", OperationKind.INGEST)).isFalse();

        clock.advance(Duration.ofSeconds(30));
        assertThat(controller.allow("c", OperationKind.INGEST)).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(controller.allow("c", OperationKind.INGEST)).isTrue();
    }

    @Test
    void subjectsAndKindsHaveSeparateBudgets() {
        for (int i = 0; i < 5; i++) {
            controller.allow("a", OperationKind.INGEST);
        }

        assertThat(controller.allow("a", OperationKind.INGEST)).isFalse();
        assertThat(controller.allow("b", OperationKind.INGEST)).isTrue();
        assertThat(controller.allow("a", OperationKind.QUERY)).isTrue();
        assertThat(controller.allow("a", OperationKind.QUERY)).isTrue();
        assertThat(controller.allow("a", OperationKind.QUERY)).isFalse();
    }

    @Test
    void unlimitedKindIsAlwaysAdmitted() {
        TokenBucketAdmissionController ingestOnly =
                TokenBucketAdmissionController.forKind(OperationKind.INGEST, new RateLimit(1, 1.0), IDLE, clock);

        for (int i = 0; i < 100; i++) {
            assertThat(ingestOnly.allow("c", OperationKind.QUERY)).isTrue();
        }
        assertThat(ingestOnly.bucketCount()).isZero();
    }

    @Test
    @DisplayName("Only buckets that are idle and full again are reaped")
    void reapsIdleFullBuckets() {
        controller.allow("idle", OperationKind.INGEST);
        clock.advance(Duration.ofSeconds(30));
        controller.allow("recent", OperationKind.INGEST);
        clock.advance(Duration.ofSeconds(31));

        assertThat(controller.reapIdle()).isEqualTo(1);
        assertThat(controller.bucketCount()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(30));
        assertThat(controller.reapIdle()).isEqualTo(1);
        assertThat(controller.bucketCount()).isZero();
    }

    @Test
    void reapedSubjectStartsWithFullBudget() {
        for (int i = 0; i < 5; i++) {
            controller.allow("c", OperationKind.INGEST);
        }
        clock.advance(IDLE);
        controller.reapIdle();

        int admitted = 0;
        for (int i = 0; i < 6; i++) {
            if (controller.allow("c", OperationKind.INGEST)) {
                admitted++;
            }
        }
        assertThat(admitted).isEqualTo(5);
    }

    @Test
    void shouldRejectNullArguments() {
        assertThatThrownBy(() -> controller.allow(null, OperationKind.INGEST))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("subject");
        assertThatThrownBy(() -> controller.allow("c", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("kind");
    }

    @Test
    @DisplayName("Concurrent callers never get more than the capacity admitted")
    void concurrentCallersShareOneBudget() throws Exception {
        TokenBucketAdmissionController shared = TokenBucketAdmissionController.forKind(
                OperationKind.INGEST, new RateLimit(100, 1.0), IDLE, clock);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        if (shared.allow("hot", OperationKind.INGEST)) {
                            admitted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(admitted.get()).isEqualTo(100);
    }

    @Test
    @DisplayName("A retired bucket admits nothing and keeps its tokens")
    void retiredBucketRefusesTokens() {
        TokenBucket bucket = new TokenBucket(new RateLimit(3, 1.0), 0L);

        assertThat(bucket.retireIfIdleAndFull(500L, 1_000L)).isFalse();
        assertThat(bucket.retireIfIdleAndFull(1_000L, 1_000L)).isTrue();
        assertThat(bucket.tryConsume(1_000L)).isEqualTo(TokenBucket.Outcome.RETIRED);
        assertThat(bucket.availableTokens(1_000L)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Reaping racing with admissions never grants more than the capacity")
    void reapingDoesNotGrantExtraTokens() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 200; round++) {
                TokenBucketAdmissionController racing = TokenBucketAdmissionController.forKind(
                        OperationKind.INGEST, new RateLimit(3, 1.0), Duration.ofSeconds(1), clock);
                racing.allow("s", OperationKind.INGEST);
                clock.advance(Duration.ofSeconds(5));

                CountDownLatch start = new CountDownLatch(1);
                AtomicInteger admitted = new AtomicInteger();
                Future<?> reaper = executor.submit(() -> {
                    start.await();
                    racing.reapIdle();
                    return null;
                });
                Future<?> caller = executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 4; i++) {
                        if (racing.allow("s", OperationKind.INGEST)) {
                            admitted.incrementAndGet();
                        }
                    }
                    return null;
                });
                start.countDown();
                reaper.get(10, TimeUnit.SECONDS);
                caller.get(10, TimeUnit.SECONDS);

                assertThat(admitted.get()).as("round %d", round).isEqualTo(3);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class MutableClock extends Clock {

        private volatile long currentMillis;
        private ZoneId zone = ZoneOffset.UTC;

        MutableClock(long startMillis) {
            this.currentMillis = startMillis;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            MutableClock copy = new MutableClock(currentMillis);
            copy.zone = Objects.requireNonNull(zone, "zone");
            return copy;
        }

        @Override
        public long millis() {
            return currentMillis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(currentMillis);
        }

        void advance(Duration duration) {
            currentMillis += duration.toMillis();
        }
    }
}
