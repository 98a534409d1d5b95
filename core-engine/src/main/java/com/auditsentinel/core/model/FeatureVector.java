package com.auditsentinel.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Numeric, fixed-schema representation of one {@link Record} for one run.
 *
 * <p>
 * All vectors of a batch are built from one {@code names} list, so the schema
 * is identical by construction. {@link #getValues()} returns a copy;
 * detectors can never change another detector's input.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector {

    private final String recordId;
    private final List<String> names;
    private final double[] values;
    private final Map<String, Object> source;

    /**
     * @param recordId identity of the record this vector describes
     * @param names    feature names, parallel to {@code values}
     * @param values   feature values; must be finite
     * @param source   read-only view of the record's original fields
     * @throws IllegalArgumentException if the lengths differ or a value is not
     *                                  finite
     */
    public FeatureVector(String recordId, List<String> names, double[] values, Map<String, Object> source) {
        this.recordId = Objects.requireNonNull(recordId, "recordId must not be null");
        this.names = Collections.unmodifiableList(Objects.requireNonNull(names, "names must not be null"));
        Objects.requireNonNull(values, "values must not be null");
        if (names.size() != values.length) {
            throw new IllegalArgumentException("Feature vector for record '" + recordId + "' has "
                    + values.length + " values but " + names.size() + " names");
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException("Feature '" + names.get(i) + "' of record '"
                        + recordId + "' is not finite: " + values[i]);
            }
        }
        this.values = values.clone();
        this.source = source != null ? Collections.unmodifiableMap(source) : Map.of();
    }

    public String getRecordId() {
        return recordId;
    }

    /**
     * @return unmodifiable list of feature names
     */
    public List<String> getNames() {
        return names;
    }

    /**
     * @return a copy of the feature values
     */
    public double[] getValues() {
        return values.clone();
    }

    /**
     * @param index feature position
     * @return the value at {@code index}
     */
    public double get(int index) {
        return values[index];
    }

    /**
     * @param name feature name
     * @return the value, or {@code NaN} if the schema has no such feature
     */
    public double get(String name) {
        int index = names.indexOf(name);
        return index < 0 ? Double.NaN : values[index];
    }

    public int size() {
        return values.length;
    }

    /**
     * @return unmodifiable view of the originating record's fields
     */
    public Map<String, Object> getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "FeatureVector{" +
                "recordId='" + recordId + '\'' +
                ", values=" + Arrays.toString(values) +
                '}';
    }
}
