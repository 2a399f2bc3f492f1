package com.seriesguard.detector;

import com.seriesguard.window.WindowSnapshot;
import javax.annotation.Nonnull;

/**
 * Scores a window snapshot and classifies the pattern of its latest observation.
 *
 * <p>Implementations must be free of shared mutable state so that detections for different
 * series can run concurrently.
 */
public interface PatternDetector {

    PatternResult detect(@Nonnull WindowSnapshot snapshot);
}
