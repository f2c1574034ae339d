package com.candlevault.data.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location of the klines endpoint. Environment variables
 * BINANCE_BASE_URL and BINANCE_KLINES_PATH take precedence over the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpstreamSettings {

    public static final String DEFAULT_BASE_URL = "https://api.binance.com";
    public static final String DEFAULT_KLINES_PATH = "/api/v3/klines";

    @JsonProperty("base_url")
    private String baseUrl = DEFAULT_BASE_URL;

    @JsonProperty("klines_path")
    private String klinesPath = DEFAULT_KLINES_PATH;

    public UpstreamSettings() {}

    public UpstreamSettings(String baseUrl, String klinesPath) {
        this.baseUrl = baseUrl;
        this.klinesPath = klinesPath;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getKlinesPath() {
        return klinesPath;
    }

    public void setKlinesPath(String klinesPath) {
        this.klinesPath = klinesPath;
    }

    /**
     * Full klines URL without query string: trailing slash stripped from the base,
     * leading slash ensured on the path.
     */
    public String klinesUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = klinesPath.startsWith("/") ? klinesPath : "/" + klinesPath;
        return base + path;
    }
}
