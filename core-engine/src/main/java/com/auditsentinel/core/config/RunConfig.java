package com.auditsentinel.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-invocation options of a detection run.
 *
 * <p>
 * Arrives as JSON from the API layer, so this is a plain bean with Jackson
 * friendly accessors. Defaults: every enabled detector, weighted fusion on,
 * the engine's {@code minConfidence}, feature importance analysis on, results
 * persisted.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunConfig {

    /** Detector names to run; empty means every enabled detector. */
    private List<String> detectors = new ArrayList<>();

    private boolean useEnsemble = true;

    /** Overrides the engine's {@code minConfidence} when set. */
    private Double minConfidence;

    private boolean analyzeFeatureImportance = true;

    private boolean persist = true;

    public static RunConfig defaults() {
        return new RunConfig();
    }

    /**
     * @param detectorNames detectors to run
     * @return a default configuration restricted to {@code detectorNames}
     */
    public static RunConfig forDetectors(String... detectorNames) {
        RunConfig config = new RunConfig();
        config.setDetectors(List.of(detectorNames));
        return config;
    }

    public List<String> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<String> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    public boolean isUseEnsemble() {
        return useEnsemble;
    }

    public void setUseEnsemble(boolean useEnsemble) {
        this.useEnsemble = useEnsemble;
    }

    public Double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(Double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public boolean isAnalyzeFeatureImportance() {
        return analyzeFeatureImportance;
    }

    public void setAnalyzeFeatureImportance(boolean analyzeFeatureImportance) {
        this.analyzeFeatureImportance = analyzeFeatureImportance;
    }

    public boolean isPersist() {
        return persist;
    }

    public void setPersist(boolean persist) {
        this.persist = persist;
    }

    @Override
    public String toString() {
        return "RunConfig{" +
                "detectors=" + detectors +
                ", useEnsemble=" + useEnsemble +
                ", minConfidence=" + minConfidence +
                ", analyzeFeatureImportance=" + analyzeFeatureImportance +
                ", persist=" + persist +
                '}';
    }
}
