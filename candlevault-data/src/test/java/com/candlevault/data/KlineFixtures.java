package com.candlevault.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Builds upstream kline payloads for tests.
 */
final class KlineFixtures {

    static final long MINUTE = 60_000L;
    static final long HOUR = 60 * MINUTE;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private KlineFixtures() {
    }

    /**
     * One Binance-style row; volume is i-dependent so rows are distinguishable.
     */
    static String row(long openTime, long stepMs, double volume) {
        return "[" + openTime + ",\"100.5\",\"110.25\",\"95.125\",\"105.0\",\"" + volume + "\","
            + (openTime + stepMs - 1) + ",\"" + (volume * 100) + "\",42,\"" + (volume / 2) + "\",\""
            + (volume * 50) + "\",\"0\"]";
    }

    /**
     * JSON array of count consecutive rows starting at startTime. Volumes are 1, 2, 3, ...
     */
    static String page(long startTime, long stepMs, int count) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (int i = 0; i < count; i++) {
            joiner.add(row(startTime + i * stepMs, stepMs, i + 1));
        }
        return joiner.toString();
    }

    static List<JsonNode> rows(String json) {
        try {
            List<JsonNode> rows = new ArrayList<>();
            MAPPER.readTree(json).forEach(rows::add);
            return rows;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<JsonNode> pageRows(long startTime, long stepMs, int count) {
        return rows(page(startTime, stepMs, count));
    }
}
