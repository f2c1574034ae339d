package com.candlevault.core.time;

/**
 * Raw window inputs as supplied by a caller. Any field may be null or blank.
 *
 * @param start    explicit start timestamp
 * @param end      explicit end timestamp
 * @param lookback relative duration such as 7d
 * @param inputTz  zone used to read start/end
 */
public record WindowRequest(String start, String end, String lookback, String inputTz) {

    public static WindowRequest lookback(String lookback) {
        return new WindowRequest(null, null, lookback, null);
    }

    public static WindowRequest between(String start, String end) {
        return new WindowRequest(start, end, null, null);
    }
}
