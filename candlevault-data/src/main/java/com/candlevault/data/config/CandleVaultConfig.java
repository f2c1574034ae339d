package com.candlevault.data.config;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.time.TimestampParser;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Typed configuration loaded from config.yml.
 *
 * <pre>
 * excel.path                     ./data/{symbol}_{interval}.csv
 * excel.append                   true
 * excel.treat_corrupt_as_empty   false
 * request.limit                  1000
 * request.rate_limit_sleep       0.2   (seconds)
 * request.timeout                30    (seconds)
 * timezone                       none  (UTC)
 * logging_level                  INFO
 * upstream.base_url              https://api.binance.com
 * upstream.klines_path           /api/v3/klines
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CandleVaultConfig {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonProperty("excel")
    private StoreSettings store = new StoreSettings();

    private RequestSettings request = new RequestSettings();

    private UpstreamSettings upstream = new UpstreamSettings();

    private String timezone;

    @JsonProperty("logging_level")
    private String loggingLevel = "INFO";

    public CandleVaultConfig() {}

    /**
     * Load from a YAML file, or defaults when the file does not exist.
     * Environment overrides for the upstream location are applied afterwards.
     */
    public static CandleVaultConfig load(Path file) throws CandleVaultException {
        return load(file, System.getenv());
    }

    static CandleVaultConfig load(Path file, Map<String, String> env) throws CandleVaultException {
        CandleVaultConfig config;
        if (file != null && Files.exists(file)) {
            try {
                JsonNode root = YAML.readTree(file.toFile());
                config = root == null || root.isMissingNode() || root.isNull()
                    ? new CandleVaultConfig()
                    : YAML.treeToValue(root, CandleVaultConfig.class);
            } catch (IOException e) {
                throw CandleVaultException.invalidConfiguration("Failed to read config " + file + ": " + e.getMessage(), e);
            }
        } else {
            config = new CandleVaultConfig();
        }
        config.applyEnvironment(env);
        config.validate();
        return config;
    }

    void applyEnvironment(Map<String, String> env) {
        String baseUrl = env.get("BINANCE_BASE_URL");
        if (baseUrl != null && !baseUrl.isBlank()) {
            upstream.setBaseUrl(baseUrl.trim());
        }
        String path = env.get("BINANCE_KLINES_PATH");
        if (path != null && !path.isBlank()) {
            upstream.setKlinesPath(path.trim());
        }
    }

    /**
     * Reject values that would only fail later, in the middle of a fetch.
     */
    public void validate() throws CandleVaultException {
        if (store == null) store = new StoreSettings();
        if (request == null) request = new RequestSettings();
        if (upstream == null) upstream = new UpstreamSettings();

        if (store.getPath() == null || store.getPath().isBlank()) {
            throw CandleVaultException.invalidConfiguration("excel.path must not be empty");
        }
        if (request.getLimit() <= 0) {
            throw CandleVaultException.invalidConfiguration("request.limit must be positive, got " + request.getLimit());
        }
        if (request.getLimit() > RequestSettings.MAX_LIMIT) {
            // A capped page would look like the last page and end the fetch early
            throw CandleVaultException.invalidConfiguration("request.limit must be at most "
                + RequestSettings.MAX_LIMIT + ", got " + request.getLimit());
        }
        if (request.getRateLimitSleep() < 0) {
            throw CandleVaultException.invalidConfiguration("request.rate_limit_sleep must not be negative");
        }
        if (request.getTimeout() <= 0) {
            throw CandleVaultException.invalidConfiguration("request.timeout must be positive");
        }
        if (upstream.getBaseUrl() == null || upstream.getBaseUrl().isBlank()) {
            throw CandleVaultException.invalidConfiguration("upstream.base_url must not be empty");
        }
        try {
            TimestampParser.resolveZone(timezone);
        } catch (CandleVaultException e) {
            throw CandleVaultException.invalidConfiguration("Unknown timezone '" + timezone + "'", e);
        }
    }

    public StoreSettings getStore() {
        return store;
    }

    public void setStore(StoreSettings store) {
        this.store = store;
    }

    public RequestSettings getRequest() {
        return request;
    }

    public void setRequest(RequestSettings request) {
        this.request = request;
    }

    public UpstreamSettings getUpstream() {
        return upstream;
    }

    public void setUpstream(UpstreamSettings upstream) {
        this.upstream = upstream;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    /**
     * Zone stored timestamps are rendered in. UTC when none is configured.
     */
    public ZoneId displayZone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        return ZoneId.of(timezone.trim());
    }
}
