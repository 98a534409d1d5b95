package com.auditsentinel.core.detection.model;

import com.auditsentinel.core.exception.ConfigurationException;
import com.auditsentinel.core.model.FeatureVector;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fitted binary logistic model over named features.
 *
 * <p>
 * Coefficients are keyed by feature name, so a model fitted offline keeps
 * working when a batch has extra or reordered columns. Features the model
 * knows but the batch lacks contribute nothing.
 * </p>
 *
 * <pre>
 * {
 *   "coefficients": { "amount_zscore": 1.8, "amount_log": 0.4 },
 *   "intercept": -3.2
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public final class LogisticClassifier {

    private final Map<String, Double> coefficients;
    private final double intercept;

    @JsonCreator
    public LogisticClassifier(@JsonProperty("coefficients") Map<String, Double> coefficients,
            @JsonProperty("intercept") double intercept) {
        Objects.requireNonNull(coefficients, "coefficients must not be null");
        if (coefficients.isEmpty()) {
            throw new IllegalArgumentException("A classifier needs at least one coefficient");
        }
        coefficients.forEach((name, weight) -> {
            if (weight == null || !Double.isFinite(weight)) {
                throw new IllegalArgumentException("Coefficient for '" + name + "' must be finite");
            }
        });
        if (!Double.isFinite(intercept)) {
            throw new IllegalArgumentException("intercept must be finite, got: " + intercept);
        }
        this.coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
        this.intercept = intercept;
    }

    /**
     * Read a model from a JSON file.
     *
     * @throws ConfigurationException if the file is missing or malformed
     */
    public static LogisticClassifier load(Path path, ObjectMapper mapper) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Classifier model file not found: " + path.toAbsolutePath());
        }
        try {
            return mapper.readValue(path.toFile(), LogisticClassifier.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Failed to read classifier model from " + path + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * @return probability that {@code vector} belongs to the anomalous class
     */
    public double probability(FeatureVector vector) {
        double z = intercept;
        for (Map.Entry<String, Double> e : coefficients.entrySet()) {
            double value = vector.get(e.getKey());
            if (!Double.isNaN(value)) {
                z += e.getValue() * value;
            }
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    public Map<String, Double> getCoefficients() {
        return coefficients;
    }

    public double getIntercept() {
        return intercept;
    }

    @Override
    public String toString() {
        return "LogisticClassifier{coefficients=" + coefficients.size() + ", intercept=" + intercept + '}';
    }
}
