package com.candlevault.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Earliest and latest timestamp present in a stored record set.
 */
public record CoverageRange(Instant min, Instant max) {

    public CoverageRange {
        if (min.isAfter(max)) {
            throw new IllegalArgumentException("min must be <= max");
        }
    }

    /**
     * Coverage of a record list in any order. Empty when the list is empty.
     */
    public static Optional<CoverageRange> of(List<CandleRecord> records) {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        Instant min = records.get(0).timestamp();
        Instant max = min;
        for (CandleRecord record : records) {
            Instant ts = record.timestamp();
            if (ts.isBefore(min)) min = ts;
            if (ts.isAfter(max)) max = ts;
        }
        return Optional.of(new CoverageRange(min, max));
    }

    public boolean covers(TimeWindow window) {
        return !min.isAfter(window.start()) && !max.isBefore(window.end());
    }
}
