package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One audit record (ledger line, voucher, transaction) as handed over by the
 * caller.
 *
 * <p>
 * Records arrive as free-form key/value maps. This class stores them as a
 * {@link Map} so the feature builder can inspect arbitrary fields without
 * requiring a rigid schema. The engine never mutates a record after it has
 * been handed in.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are safe to share once populated: detectors only ever see the
 * unmodifiable view returned by {@link #getFields()}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Record implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Every key-value pair of the original record. */
    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public Record() {
    }

    /**
     * Create a record from an existing map (copied).
     *
     * @param fields source fields; must not be {@code null}
     * @return a new record
     */
    public static Record of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "Record fields must not be null");
        Record record = new Record();
        fields.forEach(record::setField);
        return record;
    }

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the field name; must not be {@code null}
     * @param value the field value, may be {@code null} (treated as missing)
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * Return an <strong>unmodifiable</strong> view of all fields.
     *
     * @return unmodifiable map of field names to values
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    /**
     * @param fieldName the field name
     * @return optional containing the value, or empty if absent or {@code null}
     */
    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric field value, coercing common number representations.
     *
     * <p>
     * Handles {@link Number} subclasses and booleans natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers. Blank
     * strings count as missing.
     * </p>
     *
     * @param fieldName the field name
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        return toNumber(fields.get(fieldName));
    }

    /**
     * @param fieldName the field name
     * @return optional containing the string form of the value
     */
    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * @return {@code true} if the record has no non-null field
     */
    public boolean isEmpty() {
        return fields.values().stream().allMatch(Objects::isNull);
    }

    /**
     * Coerce a raw value to a number.
     *
     * @param raw raw field value
     * @return the numeric value, or empty if {@code raw} is not numeric
     */
    public static Optional<Double> toNumber(Object raw) {
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof Boolean b) {
            return Optional.of(b ? 1.0 : 0.0);
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Record that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Record" + fields;
    }
}
