package com.auditsentinel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Detector variants known to the engine, keyed by their configuration name.
 *
 * @since 1.0.0
 */
public enum DetectorType {
    OUTLIER_ENSEMBLE("outlier_ensemble"),
    DENSITY_CLUSTER("density_cluster"),
    SUPERVISED_CLASSIFIER("supervised_classifier"),
    RECONSTRUCTION_ERROR("reconstruction_error"),
    RULE_HEURISTIC("rule_heuristic");

    private final String configName;

    DetectorType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolve a type from its configuration name (case-insensitive).
     *
     * @param name configuration name, may be {@code null}
     * @return the matching type, or empty
     */
    public static Optional<DetectorType> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalised = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.configName.equals(normalised))
                .findFirst();
    }

    /**
     * @return comma-separated list of every configuration name
     */
    public static String supportedNames() {
        return Arrays.stream(values())
                .map(DetectorType::getConfigName)
                .collect(Collectors.joining(", "));
    }
}
