package com.candlevault.data.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Where and how candle stores are persisted (the {@code excel} section).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreSettings {

    public static final String DEFAULT_PATH = "./data/{symbol}_{interval}.csv";

    private String path = DEFAULT_PATH;
    private boolean append = true;

    @JsonProperty("treat_corrupt_as_empty")
    private boolean treatCorruptAsEmpty = false;

    public StoreSettings() {}

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    /**
     * When false, a sync replaces the store with the freshly fetched window
     * instead of merging into the existing records.
     */
    public boolean isAppend() {
        return append;
    }

    public void setAppend(boolean append) {
        this.append = append;
    }

    public boolean isTreatCorruptAsEmpty() {
        return treatCorruptAsEmpty;
    }

    public void setTreatCorruptAsEmpty(boolean treatCorruptAsEmpty) {
        this.treatCorruptAsEmpty = treatCorruptAsEmpty;
    }

    /**
     * Expand {symbol} and {interval} in the path template.
     */
    public Path resolvePath(String symbol, String interval) {
        return Path.of(path.replace("{symbol}", symbol).replace("{interval}", interval));
    }
}
