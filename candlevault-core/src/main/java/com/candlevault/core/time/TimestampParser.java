package com.candlevault.core.time;

import com.candlevault.core.error.CandleVaultException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Parses ISO-8601 style timestamps given on the command line or in operation files.
 *
 * Accepted forms: 2024-05-01, 2024-05-01T10:00, 2024-05-01 10:00:00,
 * 2024-05-01T10:00:00.250Z, 2024-05-01T10:00:00+05:30.
 */
public final class TimestampParser {

    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalEnd()
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
        .toFormatter();

    private TimestampParser() {
    }

    /**
     * Convert a timestamp to a UTC instant.
     *
     * With an input zone the wall-clock part is read in that zone and any embedded
     * offset is ignored. Without one, an embedded offset is honored and a bare value is UTC.
     *
     * @param raw     timestamp text
     * @param inputTz zone id, or null/blank for none
     */
    public static Instant parse(String raw, String inputTz) throws CandleVaultException {
        ZoneId zone = resolveZone(inputTz);
        String text = raw.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }

        TemporalAccessor parsed;
        LocalDateTime local;
        try {
            parsed = FORMAT.parse(text);
            local = LocalDateTime.from(parsed);
        } catch (DateTimeException e) {
            throw CandleVaultException.invalidWindow("Unparseable timestamp '" + raw + "'", e);
        }

        if (zone != null) {
            return local.atZone(zone).toInstant();
        }
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            ZoneOffset offset = ZoneOffset.ofTotalSeconds(parsed.get(ChronoField.OFFSET_SECONDS));
            return local.toInstant(offset);
        }
        return local.toInstant(ZoneOffset.UTC);
    }

    /**
     * Resolve a zone id, treating null or blank as "no zone".
     */
    public static ZoneId resolveZone(String zoneId) throws CandleVaultException {
        if (zoneId == null || zoneId.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            throw CandleVaultException.invalidWindow("Unknown timezone '" + zoneId + "'", e);
        }
    }
}
