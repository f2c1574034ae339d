package com.candlevault.data;

import com.candlevault.core.model.GapRange;
import com.candlevault.core.model.TimeWindow;

import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * Outcome of a sync.
 *
 * @param rows            candles in the merged store
 * @param fetchedRows     raw candles received from upstream in this run
 * @param missingEstimate informational gap estimate over the merged store, empty for unknown intervals
 * @param persisted       false for dry runs and when there was nothing to write
 */
public record SyncResult(
    String symbol,
    String interval,
    TimeWindow window,
    Path path,
    int rows,
    int fetchedRows,
    List<GapRange> gaps,
    OptionalLong missingEstimate,
    boolean persisted
) {
    public boolean usedExistingCoverage() {
        return gaps.isEmpty();
    }
}
