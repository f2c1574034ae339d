package com.candlevault.data;

import com.candlevault.core.error.CandleVaultException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the klines endpoint page by page until a range is exhausted.
 *
 * The cursor starts at the range start. Paging stops on an empty page, when the
 * last row closes at or after the end bound, or when a page is shorter than the
 * limit. Otherwise the cursor moves to the last close time + 1 and the next page
 * is requested after a blocking delay. Any failure aborts the whole range.
 */
public class PaginatedFetcher {

    private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);

    static final int CLOSE_TIME_INDEX = 6;

    private final KlineSource source;
    private final int limit;
    private final Duration pageDelay;

    public PaginatedFetcher(KlineSource source, int limit, Duration pageDelay) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        this.source = source;
        this.limit = limit;
        this.pageDelay = pageDelay;
    }

    /**
     * Fetch every raw row from startTime up to endTime.
     *
     * @param endTime upper bound in epoch milliseconds, or null to read until the upstream runs out
     * @throws CandleVaultException UPSTREAM_FETCH_FAILED on any transport, HTTP or protocol failure
     */
    public List<JsonNode> fetchAll(String symbol, String interval, long startTime, Long endTime)
            throws CandleVaultException {

        List<JsonNode> allRows = new ArrayList<>();
        long cursor = startTime;
        int pages = 0;

        while (true) {
            List<JsonNode> page;
            try {
                page = source.fetchPage(symbol, interval, cursor, endTime, limit);
            } catch (IOException e) {
                throw CandleVaultException.upstreamFetchFailed(
                    String.format("Failed to fetch %s %s klines at cursor %s (range %s .. %s): %s",
                        symbol, interval, Instant.ofEpochMilli(cursor), Instant.ofEpochMilli(startTime),
                        endTime != null ? Instant.ofEpochMilli(endTime) : "open", e.getMessage()),
                    e);
            }
            pages++;

            if (page.isEmpty()) {
                break;
            }
            allRows.addAll(page);

            long lastClose = closeTime(page.get(page.size() - 1), symbol, interval);
            log.debug("Page {} for {} {}: {} rows, last close {}", pages, symbol, interval, page.size(),
                Instant.ofEpochMilli(lastClose));

            if (endTime != null && lastClose >= endTime) {
                break;
            }
            if (page.size() < limit) {
                break;
            }
            cursor = lastClose + 1;
            sleep(symbol, interval);
        }

        log.debug("Fetched {} rows for {} {} in {} pages", allRows.size(), symbol, interval, pages);
        return allRows;
    }

    private static long closeTime(JsonNode row, String symbol, String interval) throws CandleVaultException {
        JsonNode close = row.get(CLOSE_TIME_INDEX);
        if (close == null || !(close.isIntegralNumber() || close.isTextual())) {
            throw CandleVaultException.upstreamFetchFailed(
                "Kline row for " + symbol + " " + interval + " has no close time: " + row, null);
        }
        try {
            return close.isIntegralNumber() ? close.asLong() : Long.parseLong(close.asText().trim());
        } catch (NumberFormatException e) {
            throw CandleVaultException.upstreamFetchFailed(
                "Kline row for " + symbol + " " + interval + " has a malformed close time: " + row, e);
        }
    }

    private void sleep(String symbol, String interval) throws CandleVaultException {
        if (pageDelay.isZero() || pageDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pageDelay.toMillis(), pageDelay.toNanosPart() % 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CandleVaultException.upstreamFetchFailed(
                "Interrupted while paging " + symbol + " " + interval, e);
        }
    }
}
