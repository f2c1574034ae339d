package com.candlevault.core.model;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Length of Binance kline interval codes such as 1m, 4h, 1d, 1w, 1M.
 * Lowercase m is minutes, uppercase M is a 30 day month.
 */
public final class KlineInterval {

    private static final Pattern CODE = Pattern.compile("(\\d+)([mMhHdDwW])");

    private KlineInterval() {
    }

    /**
     * Interval length in seconds, or empty for an unrecognized code.
     */
    public static OptionalLong seconds(String code) {
        if (code == null) {
            return OptionalLong.empty();
        }
        Matcher m = CODE.matcher(code.trim());
        if (!m.matches()) {
            return OptionalLong.empty();
        }
        long value = Long.parseLong(m.group(1));
        if (value <= 0) {
            return OptionalLong.empty();
        }
        long unitSeconds = switch (m.group(2)) {
            case "m" -> 60L;
            case "h", "H" -> 3_600L;
            case "d", "D" -> 86_400L;
            case "w", "W" -> 604_800L;
            case "M" -> 30 * 86_400L;
            default -> throw new IllegalStateException("Unhandled unit " + m.group(2));
        };
        return OptionalLong.of(value * unitSeconds);
    }

    public static OptionalLong millis(String code) {
        OptionalLong s = seconds(code);
        return s.isPresent() ? OptionalLong.of(s.getAsLong() * 1000L) : OptionalLong.empty();
    }
}
