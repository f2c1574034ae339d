package com.candlevault.data;

import com.candlevault.core.model.CandleRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CSV layout of a candle store.
 *
 * Format: timestamp,open,high,low,close,volume,quote_volume,trades,taker_buy_base,taker_buy_quote,interval,symbol
 * The timestamp carries its offset and is rendered in the display zone. Missing numbers are empty cells.
 */
final class CandleCsv {

    static final String[] COLUMNS = {
        "timestamp", "open", "high", "low", "close", "volume", "quote_volume", "trades",
        "taker_buy_base", "taker_buy_quote", "interval", "symbol"
    };
    static final String HEADER = String.join(",", COLUMNS);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private CandleCsv() {
    }

    static String toCsv(CandleRecord r, ZoneId displayZone) {
        return String.join(",",
            TIMESTAMP.format(r.timestamp().atZone(displayZone)),
            number(r.open()),
            number(r.high()),
            number(r.low()),
            number(r.close()),
            number(r.volume()),
            number(r.quoteVolume()),
            r.tradeCount() == null ? "" : r.tradeCount().toString(),
            number(r.takerBuyBase()),
            number(r.takerBuyQuote()),
            r.interval(),
            r.symbol());
    }

    /**
     * Shortest decimal that reads back to the same double.
     */
    static String number(double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        if (Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Column positions by header name. Unknown columns are ignored.
     */
    static Map<String, Integer> indexHeader(String headerLine) {
        String[] names = headerLine.split(",", -1);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            index.put(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        return index;
    }

    /**
     * Parse one data line.
     *
     * @throws IllegalArgumentException when the line does not match the header or a cell is malformed
     */
    static CandleRecord fromCsv(String line, Map<String, Integer> header, int columnCount,
                                String symbol, String interval, ZoneId displayZone) {
        String[] cells = line.split(",", -1);
        if (cells.length != columnCount) {
            throw new IllegalArgumentException("Expected " + columnCount + " cells, found " + cells.length);
        }
        String rowSymbol = text(cells, header, "symbol");
        String rowInterval = text(cells, header, "interval");
        return new CandleRecord(
            parseTimestamp(cell(cells, header, "timestamp"), displayZone),
            rowSymbol != null ? rowSymbol : symbol,
            rowInterval != null ? rowInterval : interval,
            decimal(cells, header, "open"),
            decimal(cells, header, "high"),
            decimal(cells, header, "low"),
            decimal(cells, header, "close"),
            decimal(cells, header, "volume"),
            decimal(cells, header, "quote_volume"),
            integer(cells, header, "trades"),
            decimal(cells, header, "taker_buy_base"),
            decimal(cells, header, "taker_buy_quote"));
    }

    /**
     * Accepts ISO timestamps with an offset, and bare wall-clock values (read in the display zone).
     */
    static Instant parseTimestamp(String raw, ZoneId displayZone) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Missing timestamp");
        }
        String text = raw.length() > 10 && raw.charAt(10) == ' '
            ? raw.substring(0, 10) + 'T' + raw.substring(11)
            : raw;
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).atZone(displayZone).toInstant();
            } catch (DateTimeParseException e2) {
                throw new IllegalArgumentException("Unparseable timestamp '" + raw + "'", e2);
            }
        }
    }

    private static String cell(String[] cells, Map<String, Integer> header, String column) {
        Integer i = header.get(column);
        return i == null ? null : cells[i].trim();
    }

    private static String text(String[] cells, Map<String, Integer> header, String column) {
        String value = cell(cells, header, column);
        return value == null || value.isEmpty() ? null : value;
    }

    private static double decimal(String[] cells, Map<String, Integer> header, String column) {
        String value = cell(cells, header, column);
        if (value == null || value.isEmpty() || value.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed " + column + " '" + value + "'", e);
        }
    }

    private static Long integer(String[] cells, Map<String, Integer> header, String column) {
        String value = cell(cells, header, column);
        if (value == null || value.isEmpty() || value.equalsIgnoreCase("nan")) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            // Written as a float by some tools, e.g. 42.0
            try {
                return new BigDecimal(value).longValueExact();
            } catch (NumberFormatException | ArithmeticException e2) {
                throw new IllegalArgumentException("Malformed " + column + " '" + value + "'", e2);
            }
        }
    }
}
