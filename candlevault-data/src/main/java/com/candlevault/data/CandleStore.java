package com.candlevault.data;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.model.CandleKey;
import com.candlevault.core.model.CandleRecord;
import com.candlevault.core.model.CoverageRange;
import com.candlevault.core.model.KlineInterval;
import com.candlevault.data.config.StoreSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Stores and retrieves the candles of one (symbol, interval) pair as a single CSV file.
 * The path comes from a template such as ./data/{symbol}_{interval}.csv.
 *
 * A store is always read and written in full; merge-then-overwrite is the only way
 * it changes. There is no file locking: two processes syncing the same pair at the
 * same time race, and the last writer wins.
 */
public class CandleStore {

    private static final Logger log = LoggerFactory.getLogger(CandleStore.class);

    private static final Comparator<CandleRecord> BY_TIMESTAMP = Comparator
        .comparing(CandleRecord::timestamp)
        .thenComparing(CandleRecord::symbol)
        .thenComparing(CandleRecord::interval);

    private final StoreSettings settings;
    private final ZoneId displayZone;

    public CandleStore(StoreSettings settings, ZoneId displayZone) {
        this.settings = settings;
        this.displayZone = displayZone;
    }

    public Path resolvePath(String symbol, String interval) {
        return settings.resolvePath(symbol, interval);
    }

    /**
     * Read the persisted candles for a pair.
     *
     * @return records in file order, empty when no file exists
     * @throws CandleVaultException CORRUPT_LOCAL_STORE when the file cannot be parsed,
     *                              unless the store is configured to treat that as empty
     */
    public List<CandleRecord> load(String symbol, String interval) throws CandleVaultException {
        Path file = resolvePath(symbol, interval);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            return readCsv(file, symbol, interval);
        } catch (IOException | IllegalArgumentException e) {
            String message = "Corrupt candle store " + file + " for " + symbol + " " + interval + ": " + e.getMessage();
            if (settings.isTreatCorruptAsEmpty()) {
                log.warn("{} - treating as empty, it will be overwritten on the next sync", message);
                return new ArrayList<>();
            }
            throw CandleVaultException.corruptLocalStore(message, e);
        }
    }

    private List<CandleRecord> readCsv(Path file, String symbol, String interval) throws IOException {
        List<CandleRecord> records = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                throw new IllegalArgumentException("missing header");
            }
            Map<String, Integer> header = CandleCsv.indexHeader(headerLine.trim());
            if (!header.containsKey("timestamp")) {
                throw new IllegalArgumentException("header has no timestamp column: " + headerLine);
            }
            int columnCount = headerLine.trim().split(",", -1).length;

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty()) continue;

                try {
                    records.add(CandleCsv.fromCsv(line, header, columnCount, symbol, interval, displayZone));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("line " + lineNumber + ": " + e.getMessage(), e);
                }
            }
        }

        log.debug("Loaded {} candles from {}", records.size(), file);
        return records;
    }

    /**
     * Concatenate, drop duplicate keys and sort by timestamp.
     * When both sides hold the same key the incoming record wins, so a re-fetched
     * candle (for example one that was still open) replaces the stored one.
     */
    public static List<CandleRecord> merge(List<CandleRecord> existing, List<CandleRecord> incoming) {
        Map<CandleKey, CandleRecord> byKey = new LinkedHashMap<>();
        for (CandleRecord r : existing) {
            byKey.put(r.key(), r);
        }
        for (CandleRecord r : incoming) {
            byKey.put(r.key(), r);
        }
        List<CandleRecord> merged = new ArrayList<>(byKey.values());
        merged.sort(BY_TIMESTAMP);
        return merged;
    }

    /**
     * Overwrite the persisted file for a pair with the given records.
     * Parent directories are created. Nothing is written for an empty record list.
     *
     * @return the file written, or empty when there was nothing to write
     */
    public Optional<Path> persist(List<CandleRecord> records, String symbol, String interval)
            throws CandleVaultException {
        Path file = resolvePath(symbol, interval);
        if (records.isEmpty()) {
            log.info("No data to write for {} {}", symbol, interval);
            return Optional.empty();
        }
        writeCsv(file, records);
        log.info("Wrote {} candles for {} {} to {}", records.size(), symbol, interval, file);
        return Optional.of(file);
    }

    /**
     * Write records to an arbitrary target in the store format, header included even when empty.
     */
    public void writeSlice(List<CandleRecord> records, Path target) throws CandleVaultException {
        writeCsv(target, records);
        log.debug("Wrote {} sliced candles to {}", records.size(), target);
    }

    private void writeCsv(Path file, List<CandleRecord> records) throws CandleVaultException {
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");

            try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(tmp, StandardCharsets.UTF_8))) {
                writer.println(CandleCsv.HEADER);
                for (CandleRecord r : records) {
                    writer.println(CandleCsv.toCsv(r, displayZone));
                }
                if (writer.checkError()) {
                    throw new IOException("write error on " + tmp);
                }
            }

            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw CandleVaultException.storeWriteFailed("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Rows expected between the first and last candle minus rows present, never negative.
     * Informational only.
     *
     * @return empty when the interval code is not recognized
     */
    public static OptionalLong estimateMissing(List<CandleRecord> records, String interval) {
        if (records.isEmpty()) {
            return OptionalLong.of(0);
        }
        OptionalLong step = KlineInterval.seconds(interval);
        if (step.isEmpty()) {
            return OptionalLong.empty();
        }
        CoverageRange coverage = CoverageRange.of(records).orElseThrow();
        long spanSeconds = coverage.max().getEpochSecond() - coverage.min().getEpochSecond();
        long expected = Math.floorDiv(spanSeconds, step.getAsLong()) + 1;
        return OptionalLong.of(Math.max(expected - records.size(), 0));
    }
}
