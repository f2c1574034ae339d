package com.candlevault.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed interval [start, end] of UTC instants.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must be <= end: " + start + " > " + end);
        }
    }

    public static TimeWindow ofMillis(long startMs, long endMs) {
        return new TimeWindow(Instant.ofEpochMilli(startMs), Instant.ofEpochMilli(endMs));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public long startMillis() {
        return start.toEpochMilli();
    }

    public long endMillis() {
        return end.toEpochMilli();
    }

    @Override
    public String toString() {
        return "[" + start + " .. " + end + "]";
    }
}
