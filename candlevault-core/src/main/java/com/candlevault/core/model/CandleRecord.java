package com.candlevault.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One OHLCV bucket for a (symbol, interval) pair.
 * Numeric fields that could not be coerced hold {@link Double#NaN};
 * tradeCount is null when unknown.
 */
public record CandleRecord(
    Instant timestamp,      // Bucket open time
    String symbol,
    String interval,
    double open,
    double high,
    double low,
    double close,
    double volume,
    double quoteVolume,
    Long tradeCount,
    double takerBuyBase,
    double takerBuyQuote
) {
    public CandleRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(interval, "interval");
    }

    public CandleKey key() {
        return new CandleKey(timestamp, symbol, interval);
    }

    /**
     * True when the volume field carries a usable number.
     */
    public boolean hasVolume() {
        return !Double.isNaN(volume);
    }

    public long timestampMillis() {
        return timestamp.toEpochMilli();
    }
}
