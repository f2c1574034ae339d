package com.candlevault.core.stats;

import com.candlevault.core.model.CandleRecord;
import com.candlevault.core.model.TimeWindow;
import com.candlevault.core.model.VolumeStats;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Volume statistics over an inclusive window of stored candles.
 */
public class StatsAggregator {

    public static final double P95 = 0.95;

    /**
     * Filter records to [start, end] and aggregate their volumes.
     *
     * @return empty when no record in the window has a usable volume
     */
    public Optional<VolumeStats> aggregate(List<CandleRecord> records, String symbol, String interval,
                                           TimeWindow window) {
        double[] volumes = records.stream()
            .filter(r -> window.contains(r.timestamp()))
            .filter(CandleRecord::hasVolume)
            .mapToDouble(CandleRecord::volume)
            .toArray();

        if (volumes.length == 0) {
            return Optional.empty();
        }

        return Optional.of(new VolumeStats(
            symbol,
            interval,
            window,
            volumes.length,
            mean(volumes),
            quantile(volumes, P95)
        ));
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Quantile by linear interpolation between order statistics:
     * rank = q * (n - 1), interpolated between floor(rank) and ceil(rank).
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            throw new IllegalArgumentException("No values");
        }
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("Quantile must be within [0, 1]: " + q);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = q * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
