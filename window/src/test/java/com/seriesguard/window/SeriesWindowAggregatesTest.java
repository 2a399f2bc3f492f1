package com.seriesguard.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Random;
import java.util.stream.Stream;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks that the incrementally maintained aggregates always match a direct recomputation over
 * the retained observations.
 */
@DisplayName("SeriesWindow rolling aggregates")
class SeriesWindowAggregatesTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);

    private static final double EPSILON = 1e-9;

    static Stream<Arguments> windowShapes() {
        return Stream.of(
                Arguments.of(1, 10),
                Arguments.of(3, 2),
                Arguments.of(7, 7),
                Arguments.of(10, 25),
                Arguments.of(50, 1_000),
                Arguments.of(128, 5_000));
    }

    @ParameterizedTest(name = "capacity={0}, appends={1}")
    @MethodSource("windowShapes")
    @DisplayName("Running mean and variance match recomputation over retained values")
    void runningAggregatesMatchRecomputation(int capacity, int appends) {
        ConcurrentSeriesWindowStore store =
                new ConcurrentSeriesWindowStore(capacity, 0, Duration.ofHours(1), FIXED_CLOCK);
        Random random = new Random(capacity * 31L + appends);
        double[] all = new double[appends];

        for (int i = 0; i < appends; i++) {
            all[i] = 1_000.0 + random.nextGaussian() * 25.0;
            store.append(new Observation("k", i, all[i]), false);

            if (i % 97 == 0 || i == appends - 1) {
                int retained = Math.min(i + 1, capacity);
                double[] expectedValues = Arrays.copyOfRange(all, i + 1 - retained, i + 1);
                DescriptiveStatistics expected = new DescriptiveStatistics(expectedValues);
                WindowSnapshot snapshot = store.snapshot("k").orElseThrow();

                assertEquals(retained, snapshot.getCount());
                assertEquals(expected.getMean(), snapshot.getMean(), EPSILON * Math.abs(expected.getMean()));
                assertEquals(expected.getPopulationVariance(), snapshot.getVariance(), 1e-6);
            }
        }
    }

    @Test
    @DisplayName("Constant series keeps an exact zero variance")
    void constantSeriesHasZeroVariance() {
        ConcurrentSeriesWindowStore store =
                new ConcurrentSeriesWindowStore(8, 0, Duration.ofHours(1), FIXED_CLOCK);
        for (int i = 0; i < 100; i++) {
            store.append(new Observation("cpu.load", i, 5.0));
        }

        WindowSnapshot snapshot = store.snapshot("cpu.load").orElseThrow();
        assertEquals(5.0, snapshot.getMean());
        assertEquals(0.0, snapshot.getVariance());
    }

    @Test
    @DisplayName("Large offsets do not drive the variance negative")
    void largeOffsetsKeepVarianceNonNegative() {
        ConcurrentSeriesWindowStore store =
                new ConcurrentSeriesWindowStore(4, 0, Duration.ofHours(1), FIXED_CLOCK);
        for (int i = 0; i < 1_000; i++) {
            double value = 1e12 + (i % 2 == 0 ? 1e-3 : -1e-3);
            store.append(new Observation("k", i, value), false);
            assertTrue(store.snapshot("k").orElseThrow().getVariance() >= 0.0);
        }
    }
}
