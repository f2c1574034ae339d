package com.candlevault.core.time;

import com.candlevault.core.error.CandleVaultException;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relative durations such as 30m, 12h or 7d.
 */
public final class Lookback {

    private static final Pattern EXPRESSION = Pattern.compile("(\\d+)([mhd])");

    private Lookback() {
    }

    /**
     * Parse a lookback expression: an integer immediately followed by m, h or d (case-insensitive).
     *
     * @throws CandleVaultException INVALID_DURATION when the expression does not match
     */
    public static Duration parse(String expression) throws CandleVaultException {
        if (expression == null || expression.isBlank()) {
            throw CandleVaultException.invalidDuration(expression == null ? "" : expression);
        }
        String normalized = expression.trim().toLowerCase(Locale.ROOT);
        Matcher m = EXPRESSION.matcher(normalized);
        if (!m.matches()) {
            throw CandleVaultException.invalidDuration(expression);
        }
        long value;
        try {
            value = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw CandleVaultException.invalidDuration(expression);
        }
        try {
            return switch (m.group(2)) {
                case "m" -> Duration.ofMinutes(value);
                case "h" -> Duration.ofHours(value);
                case "d" -> Duration.ofDays(value);
                default -> throw CandleVaultException.invalidDuration(expression);
            };
        } catch (ArithmeticException e) {
            throw CandleVaultException.invalidDuration(expression);
        }
    }
}
