package com.candlevault.core.model;

import java.time.Instant;

/**
 * Natural key of a stored candle. Unique within one store.
 */
public record CandleKey(Instant timestamp, String symbol, String interval) {
}
