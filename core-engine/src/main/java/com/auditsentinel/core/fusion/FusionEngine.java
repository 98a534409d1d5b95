package com.auditsentinel.core.fusion;

import com.auditsentinel.core.config.SeverityPolicy;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.AnomalyType;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import com.auditsentinel.core.model.FeatureVector;
import com.auditsentinel.core.model.IntegratedAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Merges the candidates of all detectors into one ranked
 * {@link IntegratedAnomaly} per record.
 *
 * <h3>Weighted fusion</h3>
 * <ol>
 * <li>Group candidates by record id, keeping each detector's strongest
 * candidate.</li>
 * <li>{@code confidence = Σ(confidence_i × w_i) / Σw_i} and
 * {@code score = Σ(rawScore_i × w_i) / Σw_i} over the contributing
 * detectors, rounded to 12 significant digits.</li>
 * <li>Drop groups below the minimum confidence, or whose detectors all weigh
 * 0.</li>
 * <li>Classify severity with the {@link SeverityPolicy}.</li>
 * <li>Sort by confidence descending, then record id ascending.</li>
 * </ol>
 * <p>
 * The anomaly type is the type with the largest summed weight. On a tie the
 * type voted by a rule-heuristic detector wins, otherwise the first type in
 * {@link AnomalyType} order.
 * </p>
 *
 * <p>
 * Candidates are processed in (record id, detector name) order, so the result
 * does not depend on the order detectors finished in.
 * </p>
 *
 * @since 1.0.0
 */
public class FusionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FusionEngine.class);

    /** Context snapshot keys. */
    public static final String CONTEXT_RECORD = "record";
    public static final String CONTEXT_FEATURES = "features";
    public static final String CONTEXT_FEATURE_COUNT = "featureCount";
    public static final String CONTEXT_DETECTED_AT = "detectedAt";

    private static final Comparator<AnomalyCandidate> CANDIDATE_ORDER = Comparator
            .comparing(AnomalyCandidate::getRecordId)
            .thenComparing(AnomalyCandidate::getDetectorName)
            .thenComparing(Comparator.comparingDouble(AnomalyCandidate::getConfidence).reversed())
            .thenComparing(Comparator.comparingDouble(AnomalyCandidate::getRawScore).reversed())
            .thenComparing(AnomalyCandidate::getExplanation);

    private static final int SIGNIFICANT_DIGITS = 12;
    private static final MathContext SETTLE_CONTEXT = new MathContext(SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN);

    private static final Comparator<IntegratedAnomaly> RANKING = Comparator
            .comparingDouble(IntegratedAnomaly::getConfidence).reversed()
            .thenComparing(IntegratedAnomaly::getRecordId);

    private final SeverityPolicy severityPolicy;
    private final Map<String, Double> weights;
    private final Set<String> tieBreakers;

    /**
     * @param severityPolicy severity step function
     * @param weights        detector name to weight (>= 0)
     * @param tieBreakers    detectors whose type wins a tied type vote
     */
    public FusionEngine(SeverityPolicy severityPolicy, Map<String, Double> weights, Set<String> tieBreakers) {
        this.severityPolicy = Objects.requireNonNull(severityPolicy, "severityPolicy must not be null");
        this.weights = Map.copyOf(Objects.requireNonNull(weights, "weights must not be null"));
        this.tieBreakers = Set.copyOf(Objects.requireNonNull(tieBreakers, "tieBreakers must not be null"));
    }

    /**
     * Build an engine from the detector configurations of a run. Rule-heuristic
     * detectors become the tie-breakers.
     */
    public static FusionEngine forDetectors(List<DetectorConfig> detectors, SeverityPolicy severityPolicy) {
        Map<String, Double> weights = new HashMap<>();
        Set<String> ruleDetectors = new HashSet<>();
        for (DetectorConfig config : detectors) {
            weights.put(config.getName(), config.getWeight());
            if (DetectorType.fromConfigName(config.getType()).orElse(null) == DetectorType.RULE_HEURISTIC) {
                ruleDetectors.add(config.getName());
            }
        }
        return new FusionEngine(severityPolicy, weights, ruleDetectors);
    }

    // ---------------------------------------------------------------
    // Weighted fusion
    // ---------------------------------------------------------------

    /**
     * Fuse candidates with detector weights.
     *
     * @param candidates    candidates of every detector of the run
     * @param minConfidence groups below this fused confidence are discarded
     * @param batch         features of the run, for the context snapshot
     * @param detectedAt    detection timestamp
     * @return ranked anomalies, at most one per record
     * @throws IllegalArgumentException if a candidate comes from a detector
     *                                  without a weight
     */
    public List<IntegratedAnomaly> fuse(List<AnomalyCandidate> candidates, double minConfidence,
            FeatureBatch batch, Instant detectedAt) {
        Map<String, FeatureVector> vectors = index(batch);
        List<IntegratedAnomaly> fused = new ArrayList<>();

        for (Map.Entry<String, List<AnomalyCandidate>> group : groupByRecord(candidates).entrySet()) {
            String recordId = group.getKey();
            List<AnomalyCandidate> members = group.getValue();

            double totalWeight = 0.0;
            Map<AnomalyType, Double> typeVotes = new EnumMap<>(AnomalyType.class);
            for (AnomalyCandidate c : members) {
                double w = weightOf(c.getDetectorName());
                totalWeight += w;
                typeVotes.merge(c.getAnomalyType(), w, Double::sum);
            }

            if (!(totalWeight > 0)) {
                LOG.debug("Record {} dropped: contributing detectors have zero total weight", recordId);
                continue;
            }
            double confidenceSum = 0.0;
            double scoreSum = 0.0;
            for (AnomalyCandidate c : members) {
                double share = weightOf(c.getDetectorName()) / totalWeight;
                confidenceSum += c.getConfidence() * share;
                scoreSum += c.getRawScore() * share;
            }
            double confidence = clamp(settle(confidenceSum));
            double score = settle(scoreSum);
            if (confidence < minConfidence) {
                LOG.debug("Record {} dropped: fused confidence {} < {}", recordId, confidence, minConfidence);
                continue;
            }

            fused.add(integrate(recordId, members, confidence, score, vote(typeVotes, members),
                    vectors.get(recordId), detectedAt));
        }

        fused.sort(RANKING);
        return fused;
    }

    // ---------------------------------------------------------------
    // Union (ensemble disabled)
    // ---------------------------------------------------------------

    /**
     * Combine candidates without weighting: each record keeps its most
     * confident candidate and no minimum confidence applies.
     *
     * @param candidates candidates of every detector of the run
     * @param batch      features of the run, for the context snapshot
     * @param detectedAt detection timestamp
     * @return ranked anomalies, at most one per record
     */
    public List<IntegratedAnomaly> union(List<AnomalyCandidate> candidates, FeatureBatch batch,
            Instant detectedAt) {
        Map<String, FeatureVector> vectors = index(batch);
        List<IntegratedAnomaly> merged = new ArrayList<>();

        for (Map.Entry<String, List<AnomalyCandidate>> group : groupByRecord(candidates).entrySet()) {
            List<AnomalyCandidate> members = group.getValue();
            AnomalyCandidate strongest = members.get(0);
            for (AnomalyCandidate c : members) {
                if (c.getConfidence() > strongest.getConfidence()) {
                    strongest = c;
                }
            }
            merged.add(integrate(group.getKey(), members, strongest.getConfidence(), strongest.getRawScore(),
                    strongest.getAnomalyType(), vectors.get(group.getKey()), detectedAt));
        }

        merged.sort(RANKING);
        return merged;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Map<String, List<AnomalyCandidate>> groupByRecord(List<AnomalyCandidate> candidates) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        List<AnomalyCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(CANDIDATE_ORDER);

        Map<String, List<AnomalyCandidate>> groups = new TreeMap<>();
        for (AnomalyCandidate c : ordered) {
            List<AnomalyCandidate> members = groups.computeIfAbsent(c.getRecordId(), k -> new ArrayList<>());
            // one vote per detector: the sort puts its strongest candidate first
            AnomalyCandidate last = members.isEmpty() ? null : members.get(members.size() - 1);
            if (last == null || !last.getDetectorName().equals(c.getDetectorName())) {
                members.add(c);
            }
        }
        return groups;
    }

    /**
     * Round to {@value #SIGNIFICANT_DIGITS} significant digits so that a mean
     * of equal values compares equal to them at the severity and minimum
     * confidence boundaries.
     */
    static double settle(double value) {
        if (value == 0.0 || !Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).round(SETTLE_CONTEXT).doubleValue();
    }

    private double weightOf(String detectorName) {
        Double weight = weights.get(detectorName);
        if (weight == null) {
            throw new IllegalArgumentException("No weight configured for detector '" + detectorName + "'");
        }
        return weight;
    }

    private AnomalyType vote(Map<AnomalyType, Double> votes, List<AnomalyCandidate> members) {
        double best = Collections.max(votes.values());
        List<AnomalyType> leaders = votes.entrySet().stream()
                .filter(e -> e.getValue() == best)
                .map(Map.Entry::getKey)
                .toList();
        if (leaders.size() > 1) {
            for (AnomalyCandidate c : members) {
                if (tieBreakers.contains(c.getDetectorName()) && leaders.contains(c.getAnomalyType())) {
                    return c.getAnomalyType();
                }
            }
        }
        // EnumMap iterates in declaration order
        return leaders.get(0);
    }

    private IntegratedAnomaly integrate(String recordId, List<AnomalyCandidate> members, double confidence,
            double score, AnomalyType type, FeatureVector vector, Instant detectedAt) {
        List<String> detectors = members.stream()
                .map(AnomalyCandidate::getDetectorName)
                .distinct()
                .toList();

        return IntegratedAnomaly.builder()
                .recordId(recordId)
                .anomalyType(type)
                .confidence(confidence)
                .combinedScore(score)
                .severity(severityPolicy.classify(confidence, score))
                .contributingDetectors(detectors)
                .explanation(explain(members, detectors))
                .context(snapshot(vector, detectedAt))
                .detectedAt(detectedAt)
                .build();
    }

    static String explain(List<AnomalyCandidate> members, List<String> detectors) {
        String fragments = members.stream()
                .map(c -> c.getExplanation().isEmpty()
                        ? c.getDetectorName()
                        : c.getDetectorName() + ": " + c.getExplanation())
                .collect(Collectors.joining("; "));
        return "Flagged by " + detectors.size() + (detectors.size() == 1 ? " detector" : " detectors")
                + " (" + String.join(", ", detectors) + "): " + fragments;
    }

    private static Map<String, Object> snapshot(FeatureVector vector, Instant detectedAt) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (vector != null) {
            context.put(CONTEXT_RECORD, new LinkedHashMap<>(vector.getSource()));
            Map<String, Double> features = new LinkedHashMap<>();
            for (int i = 0; i < vector.size(); i++) {
                features.put(vector.getNames().get(i), vector.get(i));
            }
            context.put(CONTEXT_FEATURES, features);
            context.put(CONTEXT_FEATURE_COUNT, vector.size());
        }
        context.put(CONTEXT_DETECTED_AT, detectedAt.toString());
        return context;
    }

    private static Map<String, FeatureVector> index(FeatureBatch batch) {
        if (batch == null) {
            return Map.of();
        }
        Map<String, FeatureVector> byId = new HashMap<>();
        for (FeatureVector v : batch.getVectors()) {
            byId.put(v.getRecordId(), v);
        }
        return byId;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
