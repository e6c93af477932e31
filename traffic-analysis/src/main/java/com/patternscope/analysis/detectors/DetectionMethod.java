package com.patternscope.analysis.detectors;

import java.util.Arrays;
import java.util.Optional;

/**
 * Recognised detection methods, declared in the order their candidates are concatenated.
 */
public enum DetectionMethod {
    ZSCORE("zscore"),
    IQR("iqr"),
    ISOLATION_FOREST("isolation_forest"),
    LOF("lof");

    private final String wireName;

    DetectionMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<DetectionMethod> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(method -> method.wireName.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
