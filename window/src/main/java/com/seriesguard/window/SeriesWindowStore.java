package com.seriesguard.window;

import java.util.Optional;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * Owns one rolling window per series key.
 *
 * <p>Appends to the same key are serialized; appends to different keys proceed in parallel.
 * Callers only ever see immutable {@link WindowSnapshot} copies.
 */
public interface SeriesWindowStore {

    /**
     * Appends an observation to the window of its series, creating the window on first use.
     *
     * <p>An observation whose timestamp is strictly earlier than the last accepted timestamp of
     * the series is rejected with {@link AppendResult.Status#OUT_OF_ORDER} and leaves the window
     * untouched. Equal timestamps are accepted.
     *
     * @param observation the point to append
     * @return the outcome, carrying a snapshot of the updated window when accepted
     */
    default AppendResult append(@Nonnull Observation observation) {
        return append(observation, true);
    }

    /**
     * Appends an observation, optionally skipping the snapshot copy.
     *
     * <p>Without a snapshot the append only touches the ring buffer and the running aggregates.
     * The result still reports the window sequence, count and fingerprint.
     *
     * @param observation the point to append
     * @param captureSnapshot whether the accepted result should carry a snapshot
     * @return the outcome of the append
     */
    default AppendResult append(@Nonnull Observation observation, boolean captureSnapshot) {
        return append(observation, captureSnapshot ? 1L : 0L);
    }

    /**
     * Appends an observation and captures a snapshot only when the resulting sequence is a
     * multiple of {@code snapshotEvery}.
     *
     * <p>The snapshot is copied under the same lock as the append, so it holds exactly the window
     * state this observation produced, whatever other appends to the series follow.
     *
     * @param observation the point to append
     * @param snapshotEvery sequence interval between snapshots, {@code 0} for none
     * @return the outcome of the append
     * @throws IllegalArgumentException if {@code snapshotEvery} is negative
     */
    AppendResult append(@Nonnull Observation observation, long snapshotEvery);

    /**
     * Returns a snapshot of the current window of a series.
     *
     * @param seriesKey the series to look up
     * @return the snapshot, or empty if the series has no window
     */
    Optional<WindowSnapshot> snapshot(@Nonnull String seriesKey);

    /**
     * Drops the windows that have not received an observation within the idle period.
     *
     * @return the keys of the evicted windows
     */
    Set<String> evictIdle();

    boolean remove(@Nonnull String seriesKey);

    int size();

    Set<String> seriesKeys();
}
