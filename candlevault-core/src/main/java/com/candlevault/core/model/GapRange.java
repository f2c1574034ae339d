package com.candlevault.core.model;

import java.time.Instant;

/**
 * A part of a requested window that is missing locally and has to be fetched.
 * The boundary kind tells which ends are inclusive.
 */
public record GapRange(Instant start, Instant end, Kind kind) {

    public enum Kind {
        /** [start, end] - nothing stored yet, or the fallback when no edge gap was found. */
        FULL,
        /** [start, end) - before the earliest stored candle; end is the coverage minimum. */
        LEADING,
        /** (start, end] - after the latest stored candle; start is the coverage maximum. */
        TRAILING
    }

    public GapRange {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must be <= end");
        }
    }

    public static GapRange full(TimeWindow window) {
        return new GapRange(window.start(), window.end(), Kind.FULL);
    }

    public boolean startInclusive() {
        return kind != Kind.TRAILING;
    }

    public boolean endInclusive() {
        return kind != Kind.LEADING;
    }

    public TimeWindow toWindow() {
        return new TimeWindow(start, end);
    }

    @Override
    public String toString() {
        return (startInclusive() ? "[" : "(") + start + " .. " + end + (endInclusive() ? "]" : ")");
    }
}
