package com.candlevault.core.gap;

import com.candlevault.core.model.CoverageRange;
import com.candlevault.core.model.GapRange;
import com.candlevault.core.model.TimeWindow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes which parts of a requested window are missing from local coverage.
 *
 * <p>Only boundary gaps are found: data before the earliest or after the latest
 * stored candle. Holes between those two points (left by an earlier failed run or
 * a manual edit) are invisible here, because coverage is tracked as a single
 * [min, max] range. Repairing interior holes needs a per-bucket scan of the store.
 */
public class GapDetector {

    /**
     * @param coverage coverage of the local store, empty when nothing is stored
     * @param window   requested window
     * @return zero, one or two ranges to fetch, in chronological order
     */
    public List<GapRange> detect(Optional<CoverageRange> coverage, TimeWindow window) {
        if (coverage.isEmpty()) {
            return List.of(GapRange.full(window));
        }

        CoverageRange covered = coverage.get();
        if (covered.covers(window)) {
            return List.of();
        }

        List<GapRange> gaps = new ArrayList<>(2);
        if (window.start().isBefore(covered.min())) {
            gaps.add(new GapRange(window.start(), covered.min(), GapRange.Kind.LEADING));
        }
        if (window.end().isAfter(covered.max())) {
            gaps.add(new GapRange(covered.max(), window.end(), GapRange.Kind.TRAILING));
        }
        if (gaps.isEmpty()) {
            // Coverage exists but produced no edge range: fetch the whole window
            gaps.add(GapRange.full(window));
        }
        return List.copyOf(gaps);
    }
}
