package com.auditsentinel.core.detection.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the fitted models that detectors need but cannot train on a single
 * batch.
 *
 * <p>
 * Models are registered explicitly, never trained as a side effect of a run.
 * Each run receives a {@link ModelHandles} snapshot, so swapping a model while
 * runs are in flight affects only later runs.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, Object> models = new ConcurrentHashMap<>();

    /**
     * Register (or replace) the model for a detector.
     *
     * @param detectorName configured detector name
     * @param model        fitted model, e.g. a {@link LogisticClassifier}
     */
    public void register(String detectorName, Object model) {
        Objects.requireNonNull(detectorName, "detectorName must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Object previous = models.put(detectorName, model);
        LOG.info("{} model for detector '{}': {}", previous == null ? "Registered" : "Replaced",
                detectorName, model);
    }

    /**
     * @return {@code true} if a model was removed
     */
    public boolean unregister(String detectorName) {
        boolean removed = models.remove(detectorName) != null;
        if (removed) {
            LOG.info("Removed model for detector '{}'", detectorName);
        }
        return removed;
    }

    public boolean contains(String detectorName) {
        return models.containsKey(detectorName);
    }

    /**
     * @return the models registered right now
     */
    public ModelHandles snapshot() {
        return new ModelHandles(models);
    }
}
