package com.candlevault.data;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.model.CandleRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts raw kline rows into candle records.
 *
 * Row layout: [openTime, open, high, low, close, volume, closeTime,
 * quoteVolume, trades, takerBuyBase, takerBuyQuote, ignore].
 * Numeric fields that do not coerce become NaN, an unreadable trade count
 * becomes null. Output keeps upstream order and may contain duplicates.
 */
public class RecordNormalizer {

    static final int MIN_FIELDS = 11;

    public List<CandleRecord> normalize(List<JsonNode> rows, String symbol, String interval)
            throws CandleVaultException {
        List<CandleRecord> records = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            records.add(normalizeRow(row, symbol, interval));
        }
        return records;
    }

    CandleRecord normalizeRow(JsonNode row, String symbol, String interval) throws CandleVaultException {
        if (row == null || !row.isArray() || row.size() < MIN_FIELDS) {
            throw CandleVaultException.upstreamFetchFailed(
                "Malformed kline row for " + symbol + " " + interval + ": " + row, null);
        }
        Long openTime = toLong(row.get(0));
        if (openTime == null) {
            throw CandleVaultException.upstreamFetchFailed(
                "Kline row for " + symbol + " " + interval + " has no usable open time: " + row, null);
        }

        return new CandleRecord(
            Instant.ofEpochMilli(openTime),
            symbol,
            interval,
            toDouble(row.get(1)),
            toDouble(row.get(2)),
            toDouble(row.get(3)),
            toDouble(row.get(4)),
            toDouble(row.get(5)),
            toDouble(row.get(7)),
            toLong(row.get(8)),
            toDouble(row.get(9)),
            toDouble(row.get(10))
        );
    }

    /**
     * Binance sends prices and volumes as strings; numbers are accepted too.
     */
    static double toDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return Double.NaN;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    static Long toLong(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            double d = node.asDouble();
            return d == Math.rint(d) && !Double.isInfinite(d) ? (long) d : null;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                // e.g. "12.0"
                try {
                    return new BigDecimal(text).longValueExact();
                } catch (NumberFormatException | ArithmeticException e2) {
                    return null;
                }
            }
        }
        return null;
    }
}
