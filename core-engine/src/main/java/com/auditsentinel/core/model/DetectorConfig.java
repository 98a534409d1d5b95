package com.auditsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of a single detector, loaded from the engine YAML.
 *
 * <p>
 * Besides the common fields ({@code name}, {@code type}, {@code enabled},
 * {@code weight}, {@code threshold}) every detector reads its
 * algorithm-specific settings from {@link #getParameters()} through the typed
 * accessors below, falling back to the supplied default.
 * </p>
 *
 * <p>
 * Instances are mutable so SnakeYAML can populate them. The engine never
 * hands a live instance to a run: every run works on {@link #copy()}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique detector name used in candidates, reports and feedback. */
    private String name;

    /** Detector variant, see {@link DetectorType}. */
    private String type;

    private boolean enabled = true;

    /** Fusion weight, must be &gt;= 0. */
    private double weight = 1.0;

    /** Detector-specific decision threshold. */
    private double threshold = 0.5;

    private Map<String, Object> parameters = new LinkedHashMap<>();

    public DetectorConfig() {
    }

    /**
     * Convenience constructor for programmatic configuration.
     */
    public DetectorConfig(String name, DetectorType type, double weight, double threshold) {
        this.name = name;
        this.type = type.getConfigName();
        this.weight = weight;
        this.threshold = threshold;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Collect every problem with this configuration.
     *
     * @return list of human-readable problems, empty when valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Detector 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Detector '" + name + "' requires 'type'");
        } else if (DetectorType.fromConfigName(type).isEmpty()) {
            errors.add("Unknown detector type: '" + type + "'. Supported: " + DetectorType.supportedNames());
        }
        if (!(weight >= 0) || Double.isInfinite(weight)) {
            errors.add("Detector '" + name + "' requires 'weight' >= 0, got: " + weight);
        }
        if (!Double.isFinite(threshold)) {
            errors.add("Detector '" + name + "' requires a finite 'threshold'");
        }
        return errors;
    }

    /**
     * @return the resolved detector type
     * @throws IllegalStateException if the type is unknown
     */
    public DetectorType detectorType() {
        return DetectorType.fromConfigName(type)
                .orElseThrow(() -> new IllegalStateException("Unknown detector type: '" + type + "'"));
    }

    /**
     * @return an independent copy, safe to hand to a single run
     */
    public DetectorConfig copy() {
        DetectorConfig copy = new DetectorConfig();
        copy.name = name;
        copy.type = type;
        copy.enabled = enabled;
        copy.weight = weight;
        copy.threshold = threshold;
        copy.setParameters(parameters);
        return copy;
    }

    // ---------------------------------------------------------------
    // Typed parameter access
    // ---------------------------------------------------------------

    public double doubleParameter(String key, double defaultValue) {
        Object raw = parameters.get(key);
        return Record.toNumber(raw).orElse(defaultValue);
    }

    public int intParameter(String key, int defaultValue) {
        Object raw = parameters.get(key);
        return Record.toNumber(raw).map(Double::intValue).orElse(defaultValue);
    }

    public long longParameter(String key, long defaultValue) {
        Object raw = parameters.get(key);
        return Record.toNumber(raw).map(Double::longValue).orElse(defaultValue);
    }

    public boolean booleanParameter(String key, boolean defaultValue) {
        Object raw = parameters.get(key);
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    public String stringParameter(String key, String defaultValue) {
        Object raw = parameters.get(key);
        return raw != null ? raw.toString() : defaultValue;
    }

    /**
     * Read a list parameter. A scalar value is treated as a one-element list.
     */
    public List<String> stringListParameter(String key, List<String> defaultValue) {
        Object raw = parameters.get(key);
        if (raw instanceof Collection<?> c) {
            return c.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        if (raw != null) {
            return List.of(raw.toString());
        }
        return defaultValue;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the detector type, normalised to lowercase.
     *
     * @param type detector type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((k, v) -> this.parameters.put(k, v instanceof List<?> l ? new ArrayList<>(l) : v));
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", enabled=" + enabled +
                ", weight=" + weight +
                ", threshold=" + threshold +
                ", parameters=" + parameters +
                '}';
    }
}
