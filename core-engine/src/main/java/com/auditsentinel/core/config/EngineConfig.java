package com.auditsentinel.core.config;

import com.auditsentinel.core.exception.ConfigurationException;
import com.auditsentinel.core.model.DetectorConfig;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * minConfidence: 0.7
 * contamination: 0.1
 * maxWorkers: 4
 * detectors:
 *   - name: rule_heuristic
 *     type: rule_heuristic
 *     weight: 0.3
 *     parameters:
 *       ceiling: 10000000
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Runs never read a live instance;
 * the coordinator snapshots it with {@link #copy()} at run start.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Fused groups below this confidence are discarded. */
    private double minConfidence = 0.7;

    /** Expected share of anomalous records; drives unsupervised cutoffs. */
    private double contamination = 0.1;

    /** Size of the detector worker pool. */
    private int maxWorkers = 4;

    /** Time budget for the whole detector group of one run. */
    private long detectorTimeoutSeconds = 60;

    /** Larger batches are rejected. */
    private int maxBatchSize = 100_000;

    /** Record field holding the record identity. */
    private String idField = "id";

    private List<String> amountKeywords = new ArrayList<>(List.of("amount", "money", "value", "金额", "余额"));

    private List<String> dateKeywords = new ArrayList<>(List.of("date", "time", "日期", "时间"));

    private SeverityPolicy severity = new SeverityPolicy();

    private List<DetectorConfig> detectors = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate global settings and every detector.
     *
     * <p>
     * Collects all problems and throws a single exception if any is found.
     * </p>
     *
     * @throws ConfigurationException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(minConfidence >= 0 && minConfidence <= 1)) {
            errors.add("'minConfidence' must be in [0, 1], got: " + minConfidence);
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            errors.add("'contamination' must be in (0, 0.5], got: " + contamination);
        }
        if (maxWorkers < 1) {
            errors.add("'maxWorkers' must be >= 1, got: " + maxWorkers);
        }
        if (detectorTimeoutSeconds < 1) {
            errors.add("'detectorTimeoutSeconds' must be >= 1, got: " + detectorTimeoutSeconds);
        }
        if (maxBatchSize < 1) {
            errors.add("'maxBatchSize' must be >= 1, got: " + maxBatchSize);
        }
        if (idField == null || idField.isBlank()) {
            errors.add("'idField' is required");
        }
        if (severity == null) {
            errors.add("'severity' must not be null");
        } else {
            errors.addAll(severity.validate());
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < detectors.size(); i++) {
            DetectorConfig detector = detectors.get(i);
            if (detector == null) {
                errors.add("Detector at index " + i + " is null");
                continue;
            }
            errors.addAll(detector.validate());
            if (detector.getName() != null && !names.add(detector.getName())) {
                errors.add("Duplicate detector name: '" + detector.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Engine configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    /**
     * @return a deep copy, safe to use as a per-run snapshot
     */
    public EngineConfig copy() {
        EngineConfig copy = new EngineConfig();
        copy.minConfidence = minConfidence;
        copy.contamination = contamination;
        copy.maxWorkers = maxWorkers;
        copy.detectorTimeoutSeconds = detectorTimeoutSeconds;
        copy.maxBatchSize = maxBatchSize;
        copy.idField = idField;
        copy.setAmountKeywords(amountKeywords);
        copy.setDateKeywords(dateKeywords);
        copy.severity = severity != null ? severity.copy() : null;
        copy.detectors = new ArrayList<>(detectors.stream().map(DetectorConfig::copy).toList());
        return copy;
    }

    /**
     * @param name detector name
     * @return the detector configuration with that name
     */
    public Optional<DetectorConfig> findDetector(String name) {
        return detectors.stream().filter(d -> d.getName().equals(name)).findFirst();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public long getDetectorTimeoutSeconds() {
        return detectorTimeoutSeconds;
    }

    public void setDetectorTimeoutSeconds(long detectorTimeoutSeconds) {
        this.detectorTimeoutSeconds = detectorTimeoutSeconds;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public String getIdField() {
        return idField;
    }

    public void setIdField(String idField) {
        this.idField = idField;
    }

    public List<String> getAmountKeywords() {
        return Collections.unmodifiableList(amountKeywords);
    }

    public void setAmountKeywords(List<String> amountKeywords) {
        this.amountKeywords = amountKeywords != null ? new ArrayList<>(amountKeywords) : new ArrayList<>();
    }

    public List<String> getDateKeywords() {
        return Collections.unmodifiableList(dateKeywords);
    }

    public void setDateKeywords(List<String> dateKeywords) {
        this.dateKeywords = dateKeywords != null ? new ArrayList<>(dateKeywords) : new ArrayList<>();
    }

    public SeverityPolicy getSeverity() {
        return severity;
    }

    public void setSeverity(SeverityPolicy severity) {
        this.severity = severity;
    }

    /**
     * Return the detector list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of detector configurations
     */
    public List<DetectorConfig> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    /**
     * Set the detector list (used by SnakeYAML during deserialization).
     *
     * @param detectors the detector configurations
     */
    public void setDetectors(List<DetectorConfig> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "minConfidence=" + minConfidence +
                ", contamination=" + contamination +
                ", maxWorkers=" + maxWorkers +
                ", detectorTimeoutSeconds=" + detectorTimeoutSeconds +
                ", maxBatchSize=" + maxBatchSize +
                ", detectors=" + detectors +
                '}';
    }
}
