package com.candlevault.runner;

import com.candlevault.core.error.CandleVaultException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named operations loaded from operations.yml.
 *
 * <pre>
 * defaults:
 *   symbol: BTCUSDT
 *   interval: 1h
 * operations:
 *   - name: btc_volume_7d
 *     type: volume_stats
 *     lookback: 7d
 * </pre>
 *
 * Every key except name and type falls back to the defaults section.
 */
public class OperationCatalog {

    private static final Logger log = LoggerFactory.getLogger(OperationCatalog.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final Map<String, OperationSpec> operations;

    OperationCatalog(Map<String, OperationSpec> operations) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
    }

    /**
     * @throws CandleVaultException INVALID_CONFIGURATION when the file is missing or unreadable,
     *                              or an operation lacks a name, symbol or interval
     */
    public static OperationCatalog load(Path file) throws CandleVaultException {
        if (!Files.exists(file)) {
            throw CandleVaultException.invalidConfiguration("Operations file not found: " + file);
        }
        JsonNode root;
        try {
            root = YAML.readTree(file.toFile());
        } catch (IOException e) {
            throw CandleVaultException.invalidConfiguration("Failed to read operations " + file + ": " + e.getMessage(), e);
        }
        if (root == null) {
            root = MissingNode.getInstance();
        }
        return parse(root);
    }

    static OperationCatalog parse(JsonNode root) throws CandleVaultException {
        JsonNode defaults = root.path("defaults");
        JsonNode items = root.path("operations");
        if (!items.isMissingNode() && !items.isNull() && !items.isArray()) {
            throw CandleVaultException.invalidConfiguration("'operations' must be a list");
        }

        Map<String, OperationSpec> specs = new LinkedHashMap<>();
        for (JsonNode item : items) {
            String name = text(item, "name");
            if (name == null) {
                throw CandleVaultException.invalidConfiguration("Operation missing name");
            }
            String symbol = field(item, defaults, "symbol");
            String interval = field(item, defaults, "interval");
            if (symbol == null) {
                throw CandleVaultException.invalidConfiguration(
                    "Operation '" + name + "' missing symbol (and no default provided)");
            }
            if (interval == null) {
                throw CandleVaultException.invalidConfiguration(
                    "Operation '" + name + "' missing interval (and no default provided)");
            }

            OperationSpec spec = new OperationSpec(
                name,
                text(item, "type"),
                symbol,
                interval,
                field(item, defaults, "lookback"),
                field(item, defaults, "start_time"),
                field(item, defaults, "end_time"),
                field(item, defaults, "time_input_timezone"),
                field(item, defaults, "slice_output_path"));

            if (specs.put(name, spec) != null) {
                log.warn("Operation '{}' defined more than once; the last definition is used", name);
            }
        }
        return new OperationCatalog(specs);
    }

    public Optional<OperationSpec> find(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    public Set<String> names() {
        return operations.keySet();
    }

    private static String field(JsonNode item, JsonNode defaults, String key) {
        String value = text(item, key);
        return value != null ? value : text(defaults, key);
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.path(key);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
