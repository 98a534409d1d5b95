package com.auditsentinel.core.feature;

import com.auditsentinel.core.config.EngineConfig;
import com.auditsentinel.core.exception.FeatureExtractionException;
import com.auditsentinel.core.model.FeatureVector;
import com.auditsentinel.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Converts a batch of raw {@link Record}s into fixed-schema
 * {@link FeatureVector}s.
 *
 * <h3>Field handling</h3>
 * <ul>
 * <li>Numeric fields pass through. Monetary fields (name contains an amount
 * keyword) add {@code _log} ({@code log1p(|v|)}), {@code _zscore} (0 when the
 * batch standard deviation is 0) and {@code _percentile}.</li>
 * <li>Date fields (name contains a date keyword and at least one value parses)
 * expand to {@code _year}, {@code _month}, {@code _day}, {@code _weekday}
 * (Monday = 0), {@code _quarter} and, when the batch is in date order,
 * {@code _day_delta} from the previous record.</li>
 * <li>Other fields are categorical: {@code _frequency} within the batch and
 * {@code _label}, a first-seen index that only identifies a category within
 * this run.</li>
 * </ul>
 *
 * <p>
 * Missing numeric values take the batch median; missing categorical values
 * become {@value #UNKNOWN}. The identity field and fields starting with an
 * underscore are not features. A batch without a usable record yields
 * {@link FeatureBatch#empty()}.
 * </p>
 *
 * <p>
 * Stateless apart from its configuration; one instance can serve concurrent
 * runs.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureBuilder.class);

    /** Sentinel category for missing text values. */
    public static final String UNKNOWN = "unknown";

    private static final List<DateTimeFormatter> DATE_TIME_PATTERNS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"));

    private static final List<DateTimeFormatter> DATE_PATTERNS = List.of(
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("yyyy.MM.dd"),
            DateTimeFormatter.BASIC_ISO_DATE);

    private enum FieldKind {
        NUMERIC, AMOUNT, DATE, CATEGORICAL
    }

    private final String idField;
    private final List<String> amountKeywords;
    private final List<String> dateKeywords;
    private final int maxBatchSize;

    public FeatureBuilder(EngineConfig config) {
        this(config.getIdField(), config.getAmountKeywords(), config.getDateKeywords(), config.getMaxBatchSize());
    }

    public FeatureBuilder(String idField, List<String> amountKeywords, List<String> dateKeywords,
            int maxBatchSize) {
        this.idField = Objects.requireNonNull(idField, "idField must not be null");
        this.amountKeywords = lowerCase(amountKeywords);
        this.dateKeywords = lowerCase(dateKeywords);
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be >= 1, got: " + maxBatchSize);
        }
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * Build feature vectors for a batch.
     *
     * @param records the batch
     * @return the features; empty when no record carries any value
     * @throws FeatureExtractionException if the batch is {@code null}, contains
     *                                    {@code null} records or exceeds the
     *                                    maximum batch size
     */
    public FeatureBatch build(List<Record> records) {
        if (records == null) {
            throw new FeatureExtractionException("Record batch must not be null");
        }
        if (records.size() > maxBatchSize) {
            throw new FeatureExtractionException("Batch of " + records.size()
                    + " records exceeds the maximum batch size of " + maxBatchSize);
        }

        List<Record> usable = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            Record record = records.get(i);
            if (record == null) {
                throw new FeatureExtractionException("Record at index " + i + " is null");
            }
            if (!record.isEmpty()) {
                usable.add(record);
                positions.add(i);
            }
        }
        if (usable.isEmpty()) {
            LOG.info("No usable records in batch of {}", records.size());
            return FeatureBatch.empty();
        }

        List<String> names = new ArrayList<>();
        List<double[]> columns = new ArrayList<>();
        List<String> amountFields = new ArrayList<>();
        List<String> monetaryFields = new ArrayList<>();

        for (String field : featureFields(usable)) {
            if (matches(field.toLowerCase(Locale.ROOT), amountKeywords)) {
                monetaryFields.add(field);
            }
            List<Object> raw = usable.stream().map(r -> r.getFields().get(field)).toList();
            FieldKind kind = classify(field, raw);
            if (kind == null) {
                continue;
            }
            switch (kind) {
                case NUMERIC -> addNumeric(field, raw, false, names, columns);
                case AMOUNT -> {
                    addNumeric(field, raw, true, names, columns);
                    amountFields.add(field);
                }
                case DATE -> addDate(field, raw, names, columns);
                case CATEGORICAL -> addCategorical(field, raw, names, columns);
            }
        }

        if (names.isEmpty()) {
            LOG.info("Batch of {} records has no feature-bearing fields", records.size());
            return FeatureBatch.empty();
        }

        List<String> schema = List.copyOf(names);
        List<String> ids = recordIds(usable, positions);
        List<FeatureVector> vectors = new ArrayList<>(usable.size());
        for (int r = 0; r < usable.size(); r++) {
            double[] values = new double[schema.size()];
            for (int c = 0; c < schema.size(); c++) {
                double v = columns.get(c)[r];
                values[c] = Double.isFinite(v) ? v : 0.0;
            }
            vectors.add(new FeatureVector(ids.get(r), schema, values, usable.get(r).getFields()));
        }

        LOG.debug("Built {} feature vector(s) with {} feature(s)", vectors.size(), schema.size());
        return new FeatureBatch(schema, vectors, amountFields, monetaryFields);
    }

    // ---------------------------------------------------------------
    // Field discovery and classification
    // ---------------------------------------------------------------

    private Set<String> featureFields(List<Record> records) {
        Set<String> fields = new LinkedHashSet<>();
        for (Record record : records) {
            for (String key : record.getFields().keySet()) {
                if (!key.equals(idField) && !key.startsWith("_")) {
                    fields.add(key);
                }
            }
        }
        return fields;
    }

    private FieldKind classify(String field, List<Object> raw) {
        List<Object> present = raw.stream().filter(FeatureBuilder::isPresent).toList();
        if (present.isEmpty()) {
            return null;
        }
        String lower = field.toLowerCase(Locale.ROOT);
        if (matches(lower, dateKeywords) && present.stream().anyMatch(v -> parseDate(v).isPresent())) {
            return FieldKind.DATE;
        }
        if (present.stream().allMatch(v -> Record.toNumber(v).isPresent())) {
            return matches(lower, amountKeywords) ? FieldKind.AMOUNT : FieldKind.NUMERIC;
        }
        return FieldKind.CATEGORICAL;
    }

    private static boolean matches(String lowerName, List<String> keywords) {
        return keywords.stream().anyMatch(lowerName::contains);
    }

    private static boolean isPresent(Object value) {
        return value != null && !(value instanceof String s && s.isBlank());
    }

    // ---------------------------------------------------------------
    // Numeric and monetary features
    // ---------------------------------------------------------------

    private void addNumeric(String field, List<Object> raw, boolean amount, List<String> names,
            List<double[]> columns) {
        double[] values = imputeWithMedian(raw.stream()
                .map(v -> Record.toNumber(v).filter(Double::isFinite).orElse(null))
                .toList());
        names.add(field);
        columns.add(values);
        if (!amount) {
            return;
        }

        double[] log = new double[values.length];
        double[] zscore = new double[values.length];
        double mean = FeatureStatistics.mean(values);
        double stddev = FeatureStatistics.sampleStdDev(values);
        for (int i = 0; i < values.length; i++) {
            log[i] = Math.log1p(Math.abs(values[i]));
            zscore[i] = stddev > 0 ? (values[i] - mean) / stddev : 0.0;
        }

        names.add(field + "_log");
        columns.add(log);
        names.add(field + "_zscore");
        columns.add(zscore);
        names.add(field + "_percentile");
        columns.add(FeatureStatistics.percentileRanks(values));
    }

    private static double[] imputeWithMedian(List<Double> values) {
        double[] present = values.stream().filter(Objects::nonNull).mapToDouble(Double::doubleValue).toArray();
        double median = present.length > 0 ? FeatureStatistics.median(present) : 0.0;
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            Double v = values.get(i);
            result[i] = v != null ? v : median;
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Date features
    // ---------------------------------------------------------------

    private void addDate(String field, List<Object> raw, List<String> names, List<double[]> columns) {
        List<LocalDate> dates = raw.stream().map(v -> parseDate(v).orElse(null)).toList();

        List<Double> year = new ArrayList<>();
        List<Double> month = new ArrayList<>();
        List<Double> day = new ArrayList<>();
        List<Double> weekday = new ArrayList<>();
        List<Double> quarter = new ArrayList<>();
        for (LocalDate date : dates) {
            year.add(date == null ? null : (double) date.getYear());
            month.add(date == null ? null : (double) date.getMonthValue());
            day.add(date == null ? null : (double) date.getDayOfMonth());
            weekday.add(date == null ? null : (double) (date.getDayOfWeek().getValue() - 1));
            quarter.add(date == null ? null : (double) ((date.getMonthValue() - 1) / 3 + 1));
        }

        names.add(field + "_year");
        columns.add(imputeWithMedian(year));
        names.add(field + "_month");
        columns.add(imputeWithMedian(month));
        names.add(field + "_day");
        columns.add(imputeWithMedian(day));
        names.add(field + "_weekday");
        columns.add(imputeWithMedian(weekday));
        names.add(field + "_quarter");
        columns.add(imputeWithMedian(quarter));

        if (isOrdered(dates)) {
            double[] delta = new double[dates.size()];
            for (int i = 1; i < dates.size(); i++) {
                delta[i] = ChronoUnit.DAYS.between(dates.get(i - 1), dates.get(i));
            }
            names.add(field + "_day_delta");
            columns.add(delta);
        }
    }

    /** Every record has a date and dates never go backwards. */
    private static boolean isOrdered(List<LocalDate> dates) {
        for (int i = 0; i < dates.size(); i++) {
            if (dates.get(i) == null || (i > 0 && dates.get(i).isBefore(dates.get(i - 1)))) {
                return false;
            }
        }
        return true;
    }

    static Optional<LocalDate> parseDate(Object value) {
        if (value instanceof LocalDate d) {
            return Optional.of(d);
        }
        if (value instanceof LocalDateTime dt) {
            return Optional.of(dt.toLocalDate());
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toLocalDate());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toLocalDate());
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant.atZone(ZoneOffset.UTC).toLocalDate());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant().atZone(ZoneOffset.UTC).toLocalDate());
        }
        if (!(value instanceof String s) || s.isBlank()) {
            return Optional.empty();
        }

        String text = s.trim();
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        for (DateTimeFormatter pattern : DATE_TIME_PATTERNS) {
            try {
                return Optional.of(LocalDateTime.parse(text, pattern).toLocalDate());
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        for (DateTimeFormatter pattern : DATE_PATTERNS) {
            try {
                return Optional.of(LocalDate.parse(text, pattern));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // Categorical features
    // ---------------------------------------------------------------

    private void addCategorical(String field, List<Object> raw, List<String> names, List<double[]> columns) {
        List<String> values = raw.stream()
                .map(v -> isPresent(v) ? v.toString() : UNKNOWN)
                .toList();

        Map<String, Integer> counts = new HashMap<>();
        Map<String, Integer> labels = new LinkedHashMap<>();
        for (String value : values) {
            counts.merge(value, 1, Integer::sum);
            labels.putIfAbsent(value, labels.size());
        }

        double[] frequency = new double[values.size()];
        double[] label = new double[values.size()];
        for (int i = 0; i < values.size(); i++) {
            frequency[i] = counts.get(values.get(i));
            label[i] = labels.get(values.get(i));
        }

        names.add(field + "_frequency");
        columns.add(frequency);
        names.add(field + "_label");
        columns.add(label);
    }

    // ---------------------------------------------------------------
    // Record identity
    // ---------------------------------------------------------------

    /**
     * Use the identity field where it is present and unique, otherwise the
     * record's position in the submitted batch. A positional id that clashes
     * with a real one gets a numeric suffix.
     */
    private List<String> recordIds(List<Record> records, List<Integer> positions) {
        Map<String, Integer> occurrences = new HashMap<>();
        for (Record record : records) {
            record.getStringField(idField).ifPresent(id -> occurrences.merge(id, 1, Integer::sum));
        }

        List<String> ids = new ArrayList<>(records.size());
        Set<String> used = new HashSet<>();
        for (Record record : records) {
            String id = record.getStringField(idField)
                    .filter(v -> !v.isBlank() && occurrences.get(v) == 1)
                    .orElse(null);
            ids.add(id);
            if (id != null) {
                used.add(id);
            }
        }

        for (int i = 0; i < ids.size(); i++) {
            if (ids.get(i) != null) {
                continue;
            }
            String positional = "row-" + positions.get(i);
            String resolved = positional;
            for (int suffix = 1; !used.add(resolved); suffix++) {
                resolved = positional + "-" + suffix;
            }
            ids.set(i, resolved);
        }
        return ids;
    }

    private static List<String> lowerCase(List<String> keywords) {
        Objects.requireNonNull(keywords, "keywords must not be null");
        return keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }
}
