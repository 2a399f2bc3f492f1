package com.seriesguard.cache;

import com.seriesguard.detector.PatternResult;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Cache of the most recent detection result per series.
 *
 * <p>A result is only returned while it was computed from the caller's current window state, as
 * identified by the window fingerprint, and while it has not expired.
 */
public interface ResultCache {

    /**
     * Looks up the result for a series and window state.
     *
     * @param seriesKey the series
     * @param windowFingerprint fingerprint of the caller's current window
     * @return the cached result, or empty on a miss, a fingerprint mismatch or an expired entry
     */
    Optional<PatternResult> get(@Nonnull String seriesKey, long windowFingerprint);

    /**
     * Stores a result under its series key and fingerprint, replacing any entry for the series.
     * A result computed from an older window than the live entry is ignored.
     *
     * @param result the result to store
     */
    void put(@Nonnull PatternResult result);

    void invalidate(@Nonnull String seriesKey);

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    int purgeExpired();

    int size();

    CacheStatistics statistics();
}
