package com.candlevault.data;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.error.ErrorKind;
import com.candlevault.core.model.CandleRecord;
import com.candlevault.core.model.GapRange;
import com.candlevault.core.model.TimeWindow;
import com.candlevault.data.config.CandleVaultConfig;
import com.candlevault.data.config.RequestSettings;
import com.candlevault.data.config.UpstreamSettings;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;

import static com.candlevault.data.KlineFixtures.HOUR;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end sync, stats and slice runs against a mock klines endpoint.
 */
class CandleSyncServiceTest {

    private static final Instant DAY_START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant DAY_END = Instant.parse("2024-01-02T00:00:00Z");
    private static final TimeWindow DAY = new TimeWindow(DAY_START, DAY_END);

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private CandleVaultConfig config;
    private Path storeFile;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        config = new CandleVaultConfig();
        config.getStore().setPath(tempDir.resolve("{symbol}_{interval}.csv").toString());
        config.setRequest(new RequestSettings(1000, 0, 5));
        config.setUpstream(new UpstreamSettings(server.url("/").toString(), "/api/v3/klines"));
        storeFile = tempDir.resolve("BTCUSDT_1h.csv");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private CandleSyncService service() {
        return new CandleSyncService(config);
    }

    private void enqueueDay() {
        server.enqueue(new MockResponse().setBody(KlineFixtures.page(DAY_START.toEpochMilli(), HOUR, 24)));
    }

    private HttpUrl takeUrl() throws InterruptedException {
        return server.takeRequest().getRequestUrl();
    }

    @Test
    @DisplayName("Empty store: one day of hourly candles is fetched, stored and aggregated")
    void emptyStoreEndToEnd() throws Exception {
        enqueueDay();

        SyncResult sync = service().sync("BTCUSDT", "1h", DAY);

        assertEquals(24, sync.rows());
        assertEquals(24, sync.fetchedRows());
        assertEquals(OptionalLong.of(0), sync.missingEstimate());
        assertTrue(sync.persisted());
        assertEquals(List.of(GapRange.full(DAY)), sync.gaps());
        assertEquals(25, Files.readAllLines(storeFile).size());

        HttpUrl first = takeUrl();
        assertEquals("BTCUSDT", first.queryParameter("symbol"));
        assertEquals("1h", first.queryParameter("interval"));
        assertEquals("1000", first.queryParameter("limit"));
        assertEquals(String.valueOf(DAY_START.toEpochMilli()), first.queryParameter("startTime"));
        assertEquals(String.valueOf(DAY_END.toEpochMilli()), first.queryParameter("endTime"));

        // Stored coverage ends at 23:00, so the trailing edge up to midnight is asked for again
        server.enqueue(new MockResponse().setBody("[]"));
        StatsResult stats = service().stats("BTCUSDT", "1h", DAY);

        assertTrue(stats.stats().isPresent());
        assertEquals(24, stats.stats().get().rows());
        assertEquals(12.5, stats.stats().get().meanVolume(), 1e-9);
        assertEquals(GapRange.Kind.TRAILING, stats.sync().gaps().get(0).kind());

        HttpUrl second = takeUrl();
        assertEquals(String.valueOf(DAY_START.plusSeconds(23 * 3600).toEpochMilli()),
            second.queryParameter("startTime"));
        assertEquals(String.valueOf(DAY_END.toEpochMilli()), second.queryParameter("endTime"));
    }

    @Test
    @DisplayName("Window inside stored coverage makes no upstream request")
    void reusesCoverage() throws Exception {
        enqueueDay();
        service().sync("BTCUSDT", "1h", DAY);
        int requests = server.getRequestCount();

        TimeWindow inner = new TimeWindow(DAY_START.plusSeconds(2 * 3600), DAY_START.plusSeconds(20 * 3600));
        SyncResult result = service().sync("BTCUSDT", "1h", inner);

        assertEquals(requests, server.getRequestCount());
        assertTrue(result.usedExistingCoverage());
        assertEquals(0, result.fetchedRows());
        assertEquals(24, result.rows());
    }

    @Test
    @DisplayName("Leading gap is fetched up to the stored minimum and merged; re-fetched candles replace stored ones")
    void leadingGap() throws Exception {
        enqueueDay();
        service().sync("BTCUSDT", "1h", DAY);
        server.takeRequest();

        Instant from = DAY_START.minusSeconds(2 * 3600);
        server.enqueue(new MockResponse().setBody(KlineFixtures.page(from.toEpochMilli(), HOUR, 3)));

        SyncResult result = service().sync("BTCUSDT", "1h",
            new TimeWindow(from, DAY_START.plusSeconds(5 * 3600)));

        assertEquals(26, result.rows());
        assertEquals(GapRange.Kind.LEADING, result.gaps().get(0).kind());

        HttpUrl url = takeUrl();
        assertEquals(String.valueOf(from.toEpochMilli()), url.queryParameter("startTime"));
        assertEquals(String.valueOf(DAY_START.toEpochMilli()), url.queryParameter("endTime"));

        List<CandleRecord> stored = new CandleStore(config.getStore(), ZoneOffset.UTC).load("BTCUSDT", "1h");
        assertEquals(26, stored.size());
        assertEquals(from, stored.get(0).timestamp());
        CandleRecord midnight = stored.get(2);
        assertEquals(DAY_START, midnight.timestamp());
        assertEquals(3.0, midnight.volume(), 1e-12, "Freshly fetched candle replaces the stored one");
    }

    @Test
    @DisplayName("Upstream failure leaves the store untouched")
    void failureLeavesStore() throws Exception {
        enqueueDay();
        service().sync("BTCUSDT", "1h", DAY);
        byte[] before = Files.readAllBytes(storeFile);

        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        CandleVaultException e = assertThrows(CandleVaultException.class,
            () -> service().sync("BTCUSDT", "1h", new TimeWindow(DAY_START.minusSeconds(86400), DAY_END)));

        assertEquals(ErrorKind.UPSTREAM_FETCH_FAILED, e.getKind());
        assertTrue(e.isRetryable());
        assertArrayEquals(before, Files.readAllBytes(storeFile));
    }

    @Test
    @DisplayName("Window wider than coverage on both sides fills both edges into one contiguous store")
    void leadingAndTrailingGaps() throws Exception {
        enqueueDay();
        service().sync("BTCUSDT", "1h", DAY);
        server.takeRequest();

        Instant from = DAY_START.minusSeconds(3 * 3600);
        Instant lastStored = DAY_START.plusSeconds(23 * 3600);
        Instant to = DAY_END.plusSeconds(2 * 3600);
        server.enqueue(new MockResponse().setBody(KlineFixtures.page(from.toEpochMilli(), HOUR, 4)));
        server.enqueue(new MockResponse().setBody(KlineFixtures.page(lastStored.toEpochMilli(), HOUR, 4)));

        SyncResult result = service().sync("BTCUSDT", "1h", new TimeWindow(from, to));

        assertEquals(List.of(GapRange.Kind.LEADING, GapRange.Kind.TRAILING),
            result.gaps().stream().map(GapRange::kind).toList());
        assertEquals(3, server.getRequestCount());
        assertEquals(24 + 3 + 3, result.rows());
        assertEquals(OptionalLong.of(0), result.missingEstimate());

        HttpUrl leading = takeUrl();
        assertEquals(String.valueOf(from.toEpochMilli()), leading.queryParameter("startTime"));
        assertEquals(String.valueOf(DAY_START.toEpochMilli()), leading.queryParameter("endTime"));
        HttpUrl trailing = takeUrl();
        assertEquals(String.valueOf(lastStored.toEpochMilli()), trailing.queryParameter("startTime"));
        assertEquals(String.valueOf(to.toEpochMilli()), trailing.queryParameter("endTime"));

        List<CandleRecord> stored = new CandleStore(config.getStore(), ZoneOffset.UTC).load("BTCUSDT", "1h");
        assertEquals(30, stored.size());
        assertEquals(from, stored.get(0).timestamp());
        assertEquals(to, stored.get(stored.size() - 1).timestamp());
        for (int i = 1; i < stored.size(); i++) {
            assertEquals(3600, stored.get(i).timestamp().getEpochSecond() - stored.get(i - 1).timestamp().getEpochSecond(),
                "Store should be contiguous at row " + i);
        }
    }

    @Test
    @DisplayName("Failure on the trailing gap discards the leading gap already fetched")
    void secondGapFailureLeavesStore() throws Exception {
        enqueueDay();
        service().sync("BTCUSDT", "1h", DAY);
        byte[] before = Files.readAllBytes(storeFile);

        Instant from = DAY_START.minusSeconds(3 * 3600);
        server.enqueue(new MockResponse().setBody(KlineFixtures.page(from.toEpochMilli(), HOUR, 4)));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        CandleVaultException e = assertThrows(CandleVaultException.class,
            () -> service().sync("BTCUSDT", "1h", new TimeWindow(from, DAY_END.plusSeconds(2 * 3600))));

        assertEquals(ErrorKind.UPSTREAM_FETCH_FAILED, e.getKind());
        assertEquals(3, server.getRequestCount(), "Initial sync plus both gap requests");
        assertArrayEquals(before, Files.readAllBytes(storeFile));
    }

    @Test
    @DisplayName("Dry run fetches and merges but writes nothing")
    void dryRun() throws Exception {
        enqueueDay();

        SyncResult result = service().sync("BTCUSDT", "1h", DAY, true);

        assertEquals(24, result.rows());
        assertFalse(result.persisted());
        assertFalse(Files.exists(storeFile));
    }

    @Test
    @DisplayName("Nothing returned for an empty store writes no file")
    void noData() throws Exception {
        server.enqueue(new MockResponse().setBody("[]"));

        SyncResult result = service().sync("BTCUSDT", "1h", DAY);

        assertEquals(0, result.rows());
        assertFalse(result.persisted());
        assertFalse(Files.exists(storeFile));
    }

    @Test
    @DisplayName("Without append the store is replaced by the fetched window")
    void replaceWithoutAppend() throws Exception {
        enqueueDay();
        service().sync("BTCUSDT", "1h", DAY);

        config.getStore().setAppend(false);
        server.enqueue(new MockResponse().setBody(KlineFixtures.page(DAY_END.toEpochMilli(), HOUR, 3)));
        SyncResult result = service().sync("BTCUSDT", "1h",
            new TimeWindow(DAY_END, DAY_END.plusSeconds(2 * 3600)));

        assertEquals(3, result.rows());
        assertEquals(4, Files.readAllLines(storeFile).size());
    }

    @Test
    @DisplayName("Slice writes only the window's candles next to the store")
    void sliceDefaultTarget() throws Exception {
        enqueueDay();
        service().sync("BTCUSDT", "1h", DAY);

        TimeWindow morning = new TimeWindow(DAY_START.plusSeconds(5 * 3600), DAY_START.plusSeconds(10 * 3600));
        SliceResult result = service().slice("BTCUSDT", "1h", morning, null);

        assertEquals(tempDir.resolve("BTCUSDT_1h_sliced.csv"), result.target());
        assertEquals(6, result.sliceRows());
        List<String> lines = Files.readAllLines(result.target());
        assertEquals(7, lines.size());
        assertTrue(lines.get(1).startsWith("2024-01-01T05:00:00Z,"), lines.get(1));
        assertTrue(lines.get(6).startsWith("2024-01-01T10:00:00Z,"), lines.get(6));
        assertEquals(25, Files.readAllLines(storeFile).size(), "Store itself keeps the full day");
    }

    @Test
    @DisplayName("Slice honors an explicit output path")
    void sliceExplicitTarget() throws Exception {
        enqueueDay();
        Path target = tempDir.resolve("exports/morning.csv");

        SliceResult result = service().slice("BTCUSDT", "1h",
            new TimeWindow(DAY_START, DAY_START.plusSeconds(3600)), target);

        assertEquals(target, result.target());
        assertEquals(2, result.sliceRows());
        assertTrue(Files.exists(target));
    }

    @Test
    void defaultSlicePath() {
        assertEquals(Path.of("data/BTCUSDT_1h_sliced.csv"),
            CandleSyncService.defaultSlicePath(Path.of("data/BTCUSDT_1h.csv")));
        assertEquals(Path.of("data/store_sliced"), CandleSyncService.defaultSlicePath(Path.of("data/store")));
    }

    @Test
    @DisplayName("Blank symbol is rejected before any I/O")
    void blankSymbol() {
        CandleVaultException e = assertThrows(CandleVaultException.class,
            () -> service().sync(" ", "1h", DAY));
        assertEquals(ErrorKind.INVALID_OPERATION, e.getKind());
        assertEquals(0, server.getRequestCount());
    }
}
