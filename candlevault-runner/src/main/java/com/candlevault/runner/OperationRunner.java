package com.candlevault.runner;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.model.TimeWindow;
import com.candlevault.core.model.VolumeStats;
import com.candlevault.core.time.WindowRequest;
import com.candlevault.core.time.WindowResolver;
import com.candlevault.data.CandleSyncService;
import com.candlevault.data.SliceResult;
import com.candlevault.data.StatsResult;
import com.candlevault.data.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves the window of a request, runs it against the sync service and turns the
 * result or error into an {@link OperationOutcome}.
 */
public class OperationRunner {

    private static final Logger log = LoggerFactory.getLogger(OperationRunner.class);

    private final CandleSyncService service;
    private final WindowResolver windowResolver;

    public OperationRunner(CandleSyncService service, WindowResolver windowResolver) {
        this.service = service;
        this.windowResolver = windowResolver;
    }

    /**
     * Run a named operation. An unknown type fails before any I/O.
     */
    public OperationOutcome run(OperationSpec op) {
        Optional<OperationType> type = OperationType.fromCode(op.type());
        if (type.isEmpty()) {
            String message = "Unsupported operation type '" + op.type() + "' for operation '" + op.name() + "'";
            log.error(message);
            return OperationOutcome.Failure.of(CandleVaultException.invalidOperation(message));
        }

        log.info("Running operation '{}' ({}) for {} {}", op.name(), type.get().getCode(), op.symbol(), op.interval());
        WindowRequest window = op.toWindowRequest();
        return switch (type.get()) {
            case FETCH -> sync(op.name(), op.symbol(), op.interval(), window, false);
            case VOLUME_STATS -> stats(op.name(), op.symbol(), op.interval(), window);
            case GENERATE_SLICED_CSV -> slice(op.name(), op.symbol(), op.interval(), window,
                op.sliceOutputPath() != null ? Path.of(op.sliceOutputPath()) : null);
        };
    }

    public OperationOutcome sync(String label, String symbol, String interval, WindowRequest request, boolean dryRun) {
        try {
            TimeWindow window = windowResolver.resolve(request);
            SyncResult result = service.sync(symbol, interval, window, dryRun);
            String summary = String.format(Locale.ROOT, "%s -> %s %s %s: rows=%d, fetched=%d, missing=%s, %s",
                label, symbol, interval, window, result.rows(), result.fetchedRows(),
                result.missingEstimate().isPresent() ? result.missingEstimate().getAsLong() : "unknown",
                result.persisted() ? "written to " + result.path() : "not written");
            if (result.rows() == 0) {
                return new OperationOutcome.NoData(label + " -> no candles for " + symbol + " " + interval + " " + window);
            }
            return new OperationOutcome.Success(summary);
        } catch (CandleVaultException e) {
            return failure(label, e);
        }
    }

    public OperationOutcome stats(String label, String symbol, String interval, WindowRequest request) {
        try {
            TimeWindow window = windowResolver.resolve(request);
            StatsResult result = service.stats(symbol, interval, window);
            if (result.stats().isEmpty()) {
                log.warn("No volume data available for operation '{}' ({} {})", label, symbol, interval);
                return new OperationOutcome.NoData(label + " -> no volume data for " + symbol + " " + interval + " " + window);
            }
            VolumeStats s = result.stats().get();
            return new OperationOutcome.Success(String.format(Locale.ROOT,
                "%s -> %s %s %s -> %s: rows=%d, avg_volume=%.6f, p95_volume=%.6f",
                label, s.symbol(), s.interval(), s.window().start(), s.window().end(),
                s.rows(), s.meanVolume(), s.p95Volume()));
        } catch (CandleVaultException e) {
            return failure(label, e);
        }
    }

    /**
     * @param output slice file, or null for the default next to the store
     */
    public OperationOutcome slice(String label, String symbol, String interval, WindowRequest request, Path output) {
        try {
            TimeWindow window = windowResolver.resolve(request);
            SliceResult result = service.slice(symbol, interval, window, output);
            String summary = String.format(Locale.ROOT, "%s -> %s %s %s: slice rows=%d, written to %s",
                label, symbol, interval, window, result.sliceRows(), result.target());
            if (result.sliceRows() == 0) {
                return new OperationOutcome.NoData(summary);
            }
            return new OperationOutcome.Success(summary);
        } catch (CandleVaultException e) {
            return failure(label, e);
        }
    }

    private static OperationOutcome failure(String label, CandleVaultException e) {
        log.error("Operation '{}' failed: {}", label, e.getMessage(), e);
        return OperationOutcome.Failure.of(e);
    }
}
