package com.candlevault.runner;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of named operation in operations.yml.
 */
public enum OperationType {
    FETCH("fetch"),
    VOLUME_STATS("volume_stats"),
    GENERATE_SLICED_CSV("generate_sliced_csv");

    private final String code;

    OperationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<OperationType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (OperationType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
