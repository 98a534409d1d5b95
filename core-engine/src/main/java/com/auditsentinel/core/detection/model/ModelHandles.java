package com.auditsentinel.core.detection.model;

import com.auditsentinel.core.exception.ModelUnavailableException;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the fitted models available to one run, keyed by
 * detector name. Taken from the {@link ModelRegistry} when a run starts.
 *
 * @since 1.0.0
 */
public final class ModelHandles {

    private static final ModelHandles NONE = new ModelHandles(Map.of());

    private final Map<String, Object> models;

    ModelHandles(Map<String, Object> models) {
        this.models = Map.copyOf(models);
    }

    public static ModelHandles none() {
        return NONE;
    }

    /**
     * @param detectorName owning detector
     * @param type         expected model class
     * @return the model, or empty if none is registered or it has another type
     */
    public <T> Optional<T> find(String detectorName, Class<T> type) {
        Object model = models.get(detectorName);
        return type.isInstance(model) ? Optional.of(type.cast(model)) : Optional.empty();
    }

    /**
     * @throws ModelUnavailableException if no model of {@code type} is
     *                                   registered for {@code detectorName}
     */
    public <T> T require(String detectorName, Class<T> type) {
        return find(detectorName, type).orElseThrow(() -> new ModelUnavailableException(detectorName));
    }

    public int size() {
        return models.size();
    }
}
