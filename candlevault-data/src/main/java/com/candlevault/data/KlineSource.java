package com.candlevault.data;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;

/**
 * One page of raw klines from the upstream API.
 */
public interface KlineSource {

    /**
     * Request a single page.
     *
     * @param symbol    trading pair, e.g. BTCUSDT
     * @param interval  kline interval, e.g. 1h
     * @param startTime cursor in epoch milliseconds
     * @param endTime   upper bound in epoch milliseconds, or null for open-ended
     * @param limit     maximum rows in the page
     * @return raw rows, each a JSON array in upstream field order
     * @throws IOException on transport failure or a non-success response
     */
    List<JsonNode> fetchPage(String symbol, String interval, long startTime, Long endTime, int limit)
        throws IOException;
}
