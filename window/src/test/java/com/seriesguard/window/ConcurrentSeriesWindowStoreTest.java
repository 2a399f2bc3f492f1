package com.seriesguard.window;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConcurrentSeriesWindowStoreTest {

    private static final Duration IDLE = Duration.ofMinutes(10);

    private MutableClock clock;
    private ConcurrentSeriesWindowStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        store = new ConcurrentSeriesWindowStore(5, 0, IDLE, clock);
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new ConcurrentSeriesWindowStore(0, 0, IDLE, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
        assertThatThrownBy(() -> new ConcurrentSeriesWindowStore(5, -1, IDLE, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seasonalPeriod");
        assertThatThrownBy(() -> new ConcurrentSeriesWindowStore(5, 0, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("idleTimeout");
    }

    @Test
    @DisplayName("First observation for a new key creates a window holding one point")
    void firstObservationCreatesWindow() {
        AppendResult result = store.append(new Observation("mem.free", 100L, 512.0));

        assertThat(result.getStatus()).isEqualTo(AppendResult.Status.ACCEPTED);
        assertThat(result.getCount()).isEqualTo(1);
        assertThat(result.getSequence()).isEqualTo(1);

        WindowSnapshot snapshot = store.snapshot("mem.free").orElseThrow();
        assertThat(snapshot.getCount()).isEqualTo(1);
        assertThat(snapshot.getMean()).isEqualTo(512.0);
        assertThat(snapshot.getVariance()).isZero();
        assertThat(snapshot.getLatestValue()).isEqualTo(512.0);
    }

    @Test
    void snapshotOfUnknownKeyIsEmpty() {
        assertThat(store.snapshot("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Out-of-order observation is rejected and leaves the window untouched")
    void outOfOrderObservationDoesNotMutate() {
        store.append(new Observation("cpu.load", 100L, 1.0));
        store.append(new Observation("cpu.load", 200L, 2.0));
        WindowSnapshot before = store.snapshot("cpu.load").orElseThrow();

        AppendResult result = store.append(new Observation("cpu.load", 150L, 99.0));

        assertThat(result.getStatus()).isEqualTo(AppendResult.Status.OUT_OF_ORDER);
        assertThat(result.getLastAcceptedTimestamp()).isEqualTo(200L);
        assertThat(result.getSnapshot()).isEmpty();
        assertThat(store.snapshot("cpu.load")).contains(before);
    }

    @Test
    void equalTimestampsAreAccepted() {
        store.append(new Observation("cpu.load", 100L, 1.0));
        AppendResult result = store.append(new Observation("cpu.load", 100L, 3.0));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getCount()).isEqualTo(2);
        assertThat(store.snapshot("cpu.load").orElseThrow().getMean()).isEqualTo(2.0);
    }

    @Test
    void nonFiniteValuesAreRejected() {
        assertThat(store.append(new Observation("k", 1L, Double.NaN)).getStatus())
                .isEqualTo(AppendResult.Status.INVALID_VALUE);
        assertThat(store.append(new Observation("k", 1L, Double.POSITIVE_INFINITY)).getStatus())
                .isEqualTo(AppendResult.Status.INVALID_VALUE);
        assertThat(store.snapshot("k")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void shouldEvictOldestWhenCapacityIsReached() {
        for (int i = 1; i <= 8; i++) {
            store.append(new Observation("k", i, i));
        }

        WindowSnapshot snapshot = store.snapshot("k").orElseThrow();
        assertThat(snapshot.getCount()).isEqualTo(5);
        assertThat(snapshot.getSequence()).isEqualTo(8);
        assertThat(snapshot.getValues()).containsExactly(4.0, 5.0, 6.0, 7.0, 8.0);
        assertThat(snapshot.getTimestamps()).containsExactly(4L, 5L, 6L, 7L, 8L);
        assertThat(snapshot.getMean()).isCloseTo(6.0, offset(1e-9));
        assertThat(snapshot.getVariance()).isCloseTo(2.0, offset(1e-9));
    }

    @Test
    @DisplayName("Snapshots are copies that later appends cannot change")
    void snapshotDoesNotAliasLiveBuffer() {
        store.append(new Observation("k", 1L, 10.0));
        WindowSnapshot snapshot = store.append(new Observation("k", 2L, 20.0)).getSnapshot().orElseThrow();

        for (int i = 3; i <= 10; i++) {
            store.append(new Observation("k", i, 1000.0 * i));
        }

        assertThat(snapshot.getValues()).containsExactly(10.0, 20.0);
        assertThat(snapshot.getMean()).isEqualTo(15.0);

        double[] exposed = snapshot.getValues();
        exposed[0] = -1.0;
        assertThat(snapshot.getValue(0)).isEqualTo(10.0);
    }

    @Test
    void appendWithoutSnapshotStillReportsFingerprint() {
        AppendResult result = store.append(new Observation("k", 1L, 10.0), false);

        assertThat(result.getSnapshot()).isEmpty();
        assertThat(result.getFingerprint()).isEqualTo(store.snapshot("k").orElseThrow().getFingerprint());
    }

    @Test
    @DisplayName("Every accepted append changes the fingerprint, even with a repeated timestamp")
    void fingerprintChangesOnEveryAppend() {
        long first = store.append(new Observation("k", 5L, 1.0)).getFingerprint();
        long second = store.append(new Observation("k", 5L, 1.0)).getFingerprint();
        long third = store.append(new Observation("k", 6L, 1.0)).getFingerprint();

        assertThat(first).isNotEqualTo(second);
        assertThat(second).isNotEqualTo(third);
        assertThat(store.snapshot("k").orElseThrow().getFingerprint()).isEqualTo(third);
    }

    @Test
    void shouldEvictIdleWindows() {
        store.append(new Observation("idle", 1L, 1.0));
        clock.advance(Duration.ofMinutes(5));
        store.append(new Observation("busy", 1L, 1.0));
        clock.advance(Duration.ofMinutes(6));

        assertThat(store.evictIdle()).containsExactly("idle");
        assertThat(store.seriesKeys()).containsExactly("busy");
        assertThat(store.snapshot("idle")).isEmpty();
    }

    @Test
    @DisplayName("An evicted key starts over with a fresh window")
    void evictedKeyStartsFresh() {
        store.append(new Observation("k", 500L, 1.0));
        long evictedGeneration = store.snapshot("k").orElseThrow().getGeneration();
        clock.advance(IDLE);
        assertThat(store.evictIdle()).containsExactly("k");

        AppendResult result = store.append(new Observation("k", 10L, 7.0));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getSequence()).isEqualTo(1);
        assertThat(store.snapshot("k").orElseThrow().getGeneration()).isGreaterThan(evictedGeneration);
    }

    @Test
    @DisplayName("Snapshots are captured on every n-th accepted append only")
    void snapshotIntervalFollowsSequence() {
        for (int i = 1; i <= 7; i++) {
            AppendResult result = store.append(new Observation("k", i, i), 3L);

            assertThat(result.getSnapshot().isPresent()).isEqualTo(i % 3 == 0);
            result.getSnapshot().ifPresent(s -> assertThat(s.getSequence()).isEqualTo(result.getSequence()));
        }
        assertThatThrownBy(() -> store.append(new Observation("k", 8L, 8.0), -1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("snapshotEvery");
    }

    @Test
    void removeDropsWindow() {
        store.append(new Observation("k", 1L, 1.0));

        assertThat(store.remove("k")).isTrue();
        assertThat(store.remove("k")).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Seasonal baseline is published once a full period has been observed")
    void seasonalBaselineAfterFullPeriod() {
        ConcurrentSeriesWindowStore seasonal = new ConcurrentSeriesWindowStore(20, 4, IDLE, clock);
        double[] cycle = {1.0, 5.0, 9.0, 5.0};
        for (int i = 0; i < 4; i++) {
            seasonal.append(new Observation("s", i, cycle[i]));
        }
        WindowSnapshot afterFirstCycle = seasonal.snapshot("s").orElseThrow();
        assertThat(afterFirstCycle.hasSeasonalBaseline()).isFalse();
        assertThat(afterFirstCycle.getLatestPhase()).isEqualTo(3);

        seasonal.append(new Observation("s", 4L, 2.0));
        WindowSnapshot crossed = seasonal.snapshot("s").orElseThrow();

        assertThat(crossed.hasSeasonalBaseline()).isTrue();
        assertThat(crossed.getLatestPhase()).isZero();
        for (int phase = 0; phase < 4; phase++) {
            assertThat(crossed.getSeasonalBaseline(phase)).isEqualTo(cycle[phase]);
        }
    }

    @Test
    void snapshotWithoutSeasonalPeriodHasNoPhase() {
        store.append(new Observation("k", 1L, 1.0));

        WindowSnapshot snapshot = store.snapshot("k").orElseThrow();
        assertThat(snapshot.getLatestPhase()).isEqualTo(-1);
        assertThatThrownBy(() -> snapshot.getSeasonalBaseline(0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void observationValidatesSeriesKeys() {
        assertThat(Observation.isValidSeriesKey("cpu.load")).isTrue();
        assertThat(Observation.isValidSeriesKey(null)).isFalse();
        assertThat(Observation.isValidSeriesKey("  ")).isFalse();
        assertThat(Observation.isValidSeriesKey("x".repeat(Observation.MAX_SERIES_KEY_LENGTH + 1))).isFalse();
        assertThatThrownBy(() -> new Observation(null, 1L, 1.0))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("seriesKey");
    }

    @Test
    void emptyResultOfUnknownKeyIsOptional() {
        Optional<WindowSnapshot> snapshot = store.snapshot("nope");
        assertThat(snapshot).isNotPresent();
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
