package com.auditsentinel.core.feature;

import com.auditsentinel.core.model.FeatureVector;

import java.util.List;
import java.util.Objects;

/**
 * Output of the {@link FeatureBuilder} for one run: the shared feature-name
 * schema, one {@link FeatureVector} per usable record, and which raw fields
 * were recognised as monetary.
 *
 * <p>
 * Immutable. Detectors receive the same instance concurrently; every
 * accessor either returns an unmodifiable view or a fresh copy.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureBatch {

    private static final FeatureBatch EMPTY = new FeatureBatch(List.of(), List.of(), List.of(), List.of());

    private final List<String> featureNames;
    private final List<FeatureVector> vectors;
    private final List<String> amountFields;
    private final List<String> monetaryFields;

    public FeatureBatch(List<String> featureNames, List<FeatureVector> vectors, List<String> amountFields) {
        this(featureNames, vectors, amountFields, amountFields);
    }

    public FeatureBatch(List<String> featureNames, List<FeatureVector> vectors, List<String> amountFields,
            List<String> monetaryFields) {
        this.featureNames = List.copyOf(Objects.requireNonNull(featureNames, "featureNames must not be null"));
        this.vectors = List.copyOf(Objects.requireNonNull(vectors, "vectors must not be null"));
        this.amountFields = List.copyOf(Objects.requireNonNull(amountFields, "amountFields must not be null"));
        this.monetaryFields = List.copyOf(Objects.requireNonNull(monetaryFields,
                "monetaryFields must not be null"));
    }

    public static FeatureBatch empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return vectors.isEmpty() || featureNames.isEmpty();
    }

    public int size() {
        return vectors.size();
    }

    public int dimensions() {
        return featureNames.size();
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public List<FeatureVector> getVectors() {
        return vectors;
    }

    /**
     * @return names of raw numeric fields recognised as monetary amounts; each
     *         is also a feature name
     */
    public List<String> getAmountFields() {
        return amountFields;
    }

    /**
     * @return names of raw fields whose name matches an amount keyword,
     *         whatever their values; a column with non-numeric entries is
     *         listed here but not in {@link #getAmountFields()}
     */
    public List<String> getMonetaryFields() {
        return monetaryFields;
    }

    /**
     * @return a fresh row-major copy of all feature values
     */
    public double[][] toMatrix() {
        double[][] matrix = new double[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            matrix[i] = vectors.get(i).getValues();
        }
        return matrix;
    }

    public String recordId(int index) {
        return vectors.get(index).getRecordId();
    }
}
