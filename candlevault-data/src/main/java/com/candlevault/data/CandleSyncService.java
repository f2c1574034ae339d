package com.candlevault.data;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.gap.GapDetector;
import com.candlevault.core.model.CandleRecord;
import com.candlevault.core.model.CoverageRange;
import com.candlevault.core.model.GapRange;
import com.candlevault.core.model.TimeWindow;
import com.candlevault.core.model.VolumeStats;
import com.candlevault.core.stats.StatsAggregator;
import com.candlevault.data.config.CandleVaultConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Incremental synchronization of a local candle store against the klines API.
 *
 * Every operation reads the store, fetches the boundary gaps of the requested window,
 * merges, and rewrites the store. All gaps are fetched before anything is written, so
 * a failed fetch leaves the store untouched. Calls are blocking and sequential.
 */
public class CandleSyncService {

    private static final Logger log = LoggerFactory.getLogger(CandleSyncService.class);

    private final CandleStore store;
    private final PaginatedFetcher fetcher;
    private final RecordNormalizer normalizer;
    private final GapDetector gapDetector;
    private final StatsAggregator statsAggregator;
    private final boolean append;

    public CandleSyncService(CandleVaultConfig config) {
        this(config, new BinanceKlineClient(config.getUpstream(), config.getRequest().requestTimeout()));
    }

    public CandleSyncService(CandleVaultConfig config, KlineSource source) {
        this(new CandleStore(config.getStore(), config.displayZone()),
            new PaginatedFetcher(source, config.getRequest().getLimit(), config.getRequest().pageDelay()),
            new RecordNormalizer(),
            new GapDetector(),
            new StatsAggregator(),
            config.getStore().isAppend());
    }

    public CandleSyncService(CandleStore store, PaginatedFetcher fetcher, RecordNormalizer normalizer,
                             GapDetector gapDetector, StatsAggregator statsAggregator, boolean append) {
        this.store = store;
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.gapDetector = gapDetector;
        this.statsAggregator = statsAggregator;
        this.append = append;
    }

    public SyncResult sync(String symbol, String interval, TimeWindow window) throws CandleVaultException {
        return sync(symbol, interval, window, false);
    }

    /**
     * Fill the window's gaps and persist the merged store.
     *
     * @param dryRun fetch and merge without writing anything
     */
    public SyncResult sync(String symbol, String interval, TimeWindow window, boolean dryRun)
            throws CandleVaultException {
        Merged merged = synchronize(symbol, interval, window);
        boolean persisted = !dryRun && store.persist(merged.records(), symbol, interval).isPresent();
        if (dryRun) {
            log.info("Dry run for {} {}: {} candles not written", symbol, interval, merged.records().size());
        }
        return merged.toResult(persisted);
    }

    /**
     * Sync the window, then aggregate volume over it.
     */
    public StatsResult stats(String symbol, String interval, TimeWindow window) throws CandleVaultException {
        Merged merged = synchronize(symbol, interval, window);
        boolean persisted = store.persist(merged.records(), symbol, interval).isPresent();

        Optional<VolumeStats> stats = statsAggregator.aggregate(merged.records(), symbol, interval, window);
        if (stats.isPresent()) {
            VolumeStats s = stats.get();
            log.info("Volume stats {} {} {}: rows={}, avg_volume={}, p95_volume={}",
                symbol, interval, window, s.rows(), s.meanVolume(), s.p95Volume());
        } else {
            log.warn("No volume data available for {} {} {}", symbol, interval, window);
        }
        return new StatsResult(merged.toResult(persisted), stats);
    }

    /**
     * Sync the window, then write just the window's candles to a second file.
     *
     * @param outputTarget slice file, or null for the store path with _sliced before the extension
     */
    public SliceResult slice(String symbol, String interval, TimeWindow window, Path outputTarget)
            throws CandleVaultException {
        Merged merged = synchronize(symbol, interval, window);
        boolean persisted = store.persist(merged.records(), symbol, interval).isPresent();

        List<CandleRecord> slice = merged.records().stream()
            .filter(r -> window.contains(r.timestamp()))
            .toList();
        Path target = outputTarget != null ? outputTarget : defaultSlicePath(store.resolvePath(symbol, interval));
        store.writeSlice(slice, target);

        log.info("Generated sliced CSV for {} {} {}: {} candles to {}", symbol, interval, window, slice.size(), target);
        return new SliceResult(merged.toResult(persisted), target, slice.size());
    }

    /**
     * data/BTCUSDT_1h.csv becomes data/BTCUSDT_1h_sliced.csv.
     */
    public static Path defaultSlicePath(Path storePath) {
        String name = storePath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String sliced = dot > 0
            ? name.substring(0, dot) + "_sliced" + name.substring(dot)
            : name + "_sliced";
        return storePath.resolveSibling(sliced);
    }

    private Merged synchronize(String symbol, String interval, TimeWindow window) throws CandleVaultException {
        requireText(symbol, "symbol");
        requireText(interval, "interval");

        log.info("Syncing {} {} for {}", symbol, interval, window);

        List<CandleRecord> existing = append ? store.load(symbol, interval) : List.of();
        Optional<CoverageRange> coverage = CoverageRange.of(existing);
        List<GapRange> gaps = gapDetector.detect(coverage, window);

        if (gaps.isEmpty()) {
            log.info("Using existing coverage for {} {}; skipping API fetch", symbol, interval);
        }

        List<CandleRecord> incoming = new ArrayList<>();
        int fetchedRows = 0;
        for (GapRange gap : gaps) {
            // Upstream bounds are inclusive; an edge candle fetched again is deduplicated on merge
            List<JsonNode> raw = fetcher.fetchAll(symbol, interval, gap.start().toEpochMilli(), gap.end().toEpochMilli());
            List<CandleRecord> fetched = normalizer.normalize(raw, symbol, interval);
            fetchedRows += fetched.size();

            List<CandleRecord> ordered = CandleStore.merge(List.of(), fetched);
            OptionalLong missing = CandleStore.estimateMissing(ordered, interval);
            log.info("Fetched klines {} {} gap {}: rows={}, missing={}, first={}, last={}",
                symbol, interval, gap, ordered.size(),
                missing.isPresent() ? missing.getAsLong() : "unknown",
                ordered.isEmpty() ? null : ordered.get(0).timestamp(),
                ordered.isEmpty() ? null : ordered.get(ordered.size() - 1).timestamp());
            incoming.addAll(fetched);
        }

        List<CandleRecord> merged = CandleStore.merge(existing, incoming);
        return new Merged(symbol, interval, window, store.resolvePath(symbol, interval), merged, gaps, fetchedRows);
    }

    private static void requireText(String value, String name) throws CandleVaultException {
        if (value == null || value.isBlank()) {
            throw CandleVaultException.invalidOperation("Missing required " + name);
        }
    }

    private record Merged(String symbol, String interval, TimeWindow window, Path path,
                          List<CandleRecord> records, List<GapRange> gaps, int fetchedRows) {

        SyncResult toResult(boolean persisted) {
            return new SyncResult(symbol, interval, window, path, records.size(), fetchedRows, gaps,
                CandleStore.estimateMissing(records, interval), persisted);
        }
    }
}
