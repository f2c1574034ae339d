package com.candlevault.data.config;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.error.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CandleVaultConfigTest {

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    @DisplayName("All keys are read from YAML")
    void readsAllKeys() throws Exception {
        Path file = write("""
            excel:
              path: ./out/{symbol}-{interval}.csv
              append: false
              treat_corrupt_as_empty: true
            request:
              limit: 500
              rate_limit_sleep: 0.5
              timeout: 10
            timezone: Europe/Berlin
            logging_level: DEBUG
            upstream:
              base_url: https://example.test/
              klines_path: fapi/v1/klines
            something_else: ignored
            """);

        CandleVaultConfig config = CandleVaultConfig.load(file, Map.of());

        assertEquals("./out/{symbol}-{interval}.csv", config.getStore().getPath());
        assertFalse(config.getStore().isAppend());
        assertTrue(config.getStore().isTreatCorruptAsEmpty());
        assertEquals(500, config.getRequest().getLimit());
        assertEquals(Duration.ofMillis(500), config.getRequest().pageDelay());
        assertEquals(Duration.ofSeconds(10), config.getRequest().requestTimeout());
        assertEquals(ZoneId.of("Europe/Berlin"), config.displayZone());
        assertEquals("DEBUG", config.getLoggingLevel());
        assertEquals("https://example.test/fapi/v1/klines", config.getUpstream().klinesUrl());
        assertEquals(Path.of("./out/ETHUSDT-4h.csv"), config.getStore().resolvePath("ETHUSDT", "4h"));
    }

    @Test
    @DisplayName("Missing file and empty file both give defaults")
    void defaults() throws Exception {
        for (Path file : new Path[]{tempDir.resolve("absent.yml"), write("")}) {
            CandleVaultConfig config = CandleVaultConfig.load(file, Map.of());

            assertEquals(StoreSettings.DEFAULT_PATH, config.getStore().getPath());
            assertTrue(config.getStore().isAppend());
            assertFalse(config.getStore().isTreatCorruptAsEmpty());
            assertEquals(1000, config.getRequest().getLimit());
            assertEquals(Duration.ofMillis(200), config.getRequest().pageDelay());
            assertEquals(Duration.ofSeconds(30), config.getRequest().requestTimeout());
            assertEquals(ZoneOffset.UTC, config.displayZone());
            assertEquals("INFO", config.getLoggingLevel());
            assertEquals("https://api.binance.com/api/v3/klines", config.getUpstream().klinesUrl());
        }
    }

    @Test
    @DisplayName("Partial sections keep defaults for the keys they omit")
    void partialSection() throws Exception {
        CandleVaultConfig config = CandleVaultConfig.load(write("request:\n  limit: 200\n"), Map.of());

        assertEquals(200, config.getRequest().getLimit());
        assertEquals(Duration.ofSeconds(30), config.getRequest().requestTimeout());
    }

    @Test
    @DisplayName("Environment overrides the upstream location")
    void environmentOverride() throws Exception {
        Path file = write("upstream:\n  base_url: https://from-file.test\n");

        CandleVaultConfig config = CandleVaultConfig.load(file, Map.of(
            "BINANCE_BASE_URL", "http://localhost:9999",
            "BINANCE_KLINES_PATH", "/mock/klines"));

        assertEquals("http://localhost:9999/mock/klines", config.getUpstream().klinesUrl());
    }

    @Test
    void rejectsNonPositiveLimit() throws Exception {
        CandleVaultException e = assertThrows(CandleVaultException.class,
            () -> CandleVaultConfig.load(write("request:\n  limit: 0\n"), Map.of()));
        assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
    }

    @Test
    @DisplayName("Page size above the upstream cap is rejected instead of truncating fetches")
    void rejectsLimitAboveUpstreamCap() throws Exception {
        CandleVaultException e = assertThrows(CandleVaultException.class,
            () -> CandleVaultConfig.load(write("request:\n  limit: 1500\n"), Map.of()));
        assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
        assertTrue(e.getMessage().contains("1000"), e.getMessage());
    }

    @Test
    void acceptsLimitAtUpstreamCap() throws Exception {
        CandleVaultConfig config = CandleVaultConfig.load(write("request:\n  limit: 1000\n"), Map.of());
        assertEquals(RequestSettings.MAX_LIMIT, config.getRequest().getLimit());
    }

    @Test
    void rejectsUnknownTimezone() throws Exception {
        CandleVaultException e = assertThrows(CandleVaultException.class,
            () -> CandleVaultConfig.load(write("timezone: Mars/Olympus\n"), Map.of()));
        assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
    }

    @Test
    void rejectsMalformedYaml() throws Exception {
        CandleVaultException e = assertThrows(CandleVaultException.class,
            () -> CandleVaultConfig.load(write("request: [unclosed\n"), Map.of()));
        assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
    }
}
