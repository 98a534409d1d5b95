package com.auditsentinel.core.fusion;

import com.auditsentinel.core.SampleRecords;
import com.auditsentinel.core.config.SeverityPolicy;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.AnomalyType;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import com.auditsentinel.core.model.IntegratedAnomaly;
import com.auditsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FusionEngine}.
 */
class FusionEngineTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private FusionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FusionEngine(new SeverityPolicy(),
                Map.of("forest", 0.3, "rules", 1.0, "classifier", 0.4, "dbscan", 0.3, "muted", 0.0),
                Set.of("rules"));
    }

    @Nested
    @DisplayName("Weighted fusion")
    class WeightedFusion {

        @Test
        @DisplayName("Should compute weighted mean confidence and score")
        void shouldComputeWeightedMeans() {
            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("r1", "forest", 0.6, 0.7, AnomalyType.STATISTICAL),
                    candidate("r1", "rules", 0.9, 1.0, AnomalyType.BUSINESS)), 0.7, null, NOW);

            assertThat(fused).singleElement().satisfies(a -> {
                assertThat(a.getConfidence()).isCloseTo((0.6 * 0.3 + 0.9) / 1.3, within(1e-12));
                assertThat(a.getCombinedScore()).isCloseTo((0.7 * 0.3 + 1.0) / 1.3, within(1e-12));
                assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
                assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.BUSINESS);
                assertThat(a.getContributingDetectors()).containsExactly("forest", "rules");
                assertThat(a.getDetectedAt()).isEqualTo(NOW);
            });
        }

        @Test
        @DisplayName("Should keep fused confidence within [0, 1]")
        void shouldStayWithinBounds() {
            Random random = new Random(11);
            List<String> detectors = List.of("forest", "rules", "classifier", "dbscan");
            List<AnomalyCandidate> candidates = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                candidates.add(candidate("r" + random.nextInt(30), detectors.get(random.nextInt(4)),
                        random.nextDouble(), random.nextDouble() * 5, AnomalyType.STATISTICAL));
            }

            List<IntegratedAnomaly> fused = engine.fuse(candidates, 0.0, null, NOW);

            assertThat(fused).isNotEmpty();
            assertThat(fused).allSatisfy(a -> assertThat(a.getConfidence()).isBetween(0.0, 1.0));
        }

        @Test
        @DisplayName("Should produce the same result regardless of candidate order")
        void shouldBeOrderIndependent() {
            List<AnomalyCandidate> candidates = new ArrayList<>(List.of(
                    candidate("r1", "forest", 0.8, 0.7, AnomalyType.STATISTICAL),
                    candidate("r1", "dbscan", 0.8, 1.0, AnomalyType.PATTERN),
                    candidate("r2", "rules", 0.9, 1.0, AnomalyType.BUSINESS),
                    candidate("r3", "classifier", 0.75, 0.75, AnomalyType.BUSINESS)));

            List<IntegratedAnomaly> first = engine.fuse(candidates, 0.7, null, NOW);
            Collections.reverse(candidates);
            List<IntegratedAnomaly> second = engine.fuse(candidates, 0.7, null, NOW);

            assertThat(second).usingRecursiveFieldByFieldElementComparator().isEqualTo(first);
        }

        @Test
        @DisplayName("Should raise confidence when the more confident detector weighs more")
        void shouldBeMonotonicInWeight() {
            List<AnomalyCandidate> candidates = List.of(
                    candidate("r1", "forest", 0.5, 0.5, AnomalyType.STATISTICAL),
                    candidate("r1", "rules", 0.9, 1.0, AnomalyType.BUSINESS));
            FusionEngine light = new FusionEngine(new SeverityPolicy(), Map.of("forest", 0.5, "rules", 0.5),
                    Set.of());
            FusionEngine heavy = new FusionEngine(new SeverityPolicy(), Map.of("forest", 0.5, "rules", 2.0),
                    Set.of());

            double lightConfidence = light.fuse(candidates, 0.0, null, NOW).get(0).getConfidence();
            double heavyConfidence = heavy.fuse(candidates, 0.0, null, NOW).get(0).getConfidence();

            assertThat(heavyConfidence).isGreaterThan(lightConfidence);
        }

        @Test
        @DisplayName("Should emit one anomaly per record with sorted detector names")
        void shouldDeduplicateRecords() {
            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("r1", "rules", 0.9, 1.0, AnomalyType.BUSINESS),
                    candidate("r1", "forest", 0.9, 0.8, AnomalyType.STATISTICAL),
                    candidate("r1", "classifier", 0.9, 0.9, AnomalyType.BUSINESS)), 0.7, null, NOW);

            assertThat(fused).singleElement().satisfies(a -> assertThat(a.getContributingDetectors())
                    .containsExactly("classifier", "forest", "rules"));
        }

        @Test
        @DisplayName("Should classify a single confident detector as critical")
        void shouldClassifyCritical() {
            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("r1", "rules", 0.9, 0.5, AnomalyType.BUSINESS)), 0.7, null, NOW);

            assertThat(fused).singleElement().satisfies(a -> {
                assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL);
                assertThat(a.getConfidence()).isEqualTo(0.9);
                assertThat(a.getContributingDetectors()).containsExactly("rules");
            });
        }

        @Test
        @DisplayName("Should keep a group exactly at the minimum and drop one below it")
        void shouldApplyMinConfidence() {
            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("kept", "rules", 0.75, 0.5, AnomalyType.BUSINESS),
                    candidate("dropped", "rules", 0.7499, 0.5, AnomalyType.BUSINESS)), 0.75, null, NOW);

            assertThat(fused).extracting(IntegratedAnomaly::getRecordId).containsExactly("kept");
        }

        @Test
        @DisplayName("Should keep equal confidences of several detectors exactly on the critical boundary")
        void shouldKeepEqualConfidencesOnBoundary() {
            FusionEngine unevenWeights = new FusionEngine(new SeverityPolicy(), Map.of("a", 0.3, "b", 0.5),
                    Set.of());

            List<IntegratedAnomaly> fused = unevenWeights.fuse(List.of(
                    candidate("r1", "a", 0.9, 2.0, AnomalyType.STATISTICAL),
                    candidate("r1", "b", 0.9, 2.0, AnomalyType.STATISTICAL)), 0.9, null, NOW);

            assertThat(fused).singleElement().satisfies(a -> {
                assertThat(a.getConfidence()).isEqualTo(0.9);
                assertThat(a.getCombinedScore()).isEqualTo(2.0);
                assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL);
            });
        }

        @Test
        @DisplayName("Should count each detector once per record, using its strongest candidate")
        void shouldCountDetectorOncePerRecord() {
            List<AnomalyCandidate> candidates = List.of(
                    candidate("r1", "forest", 0.5, 0.5, AnomalyType.STATISTICAL),
                    candidate("r1", "forest", 0.6, 0.7, AnomalyType.STATISTICAL),
                    candidate("r1", "rules", 0.9, 1.0, AnomalyType.BUSINESS));

            List<IntegratedAnomaly> fused = engine.fuse(candidates, 0.0, null, NOW);

            assertThat(fused).singleElement().satisfies(a -> {
                assertThat(a.getConfidence()).isCloseTo((0.6 * 0.3 + 0.9) / 1.3, within(1e-12));
                assertThat(a.getContributingDetectors()).containsExactly("forest", "rules");
                assertThat(a.getExplanation()).isEqualTo(
                        "Flagged by 2 detectors (forest, rules): forest: explained by forest; rules: explained by rules");
            });
        }

        @Test
        @DisplayName("Should rank by confidence, then record id")
        void shouldRankDeterministically() {
            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("b", "classifier", 0.8, 0.5, AnomalyType.BUSINESS),
                    candidate("c", "classifier", 0.95, 0.5, AnomalyType.BUSINESS),
                    candidate("a", "classifier", 0.8, 0.5, AnomalyType.BUSINESS)), 0.7, null, NOW);

            assertThat(fused).extracting(IntegratedAnomaly::getRecordId).containsExactly("c", "a", "b");
        }

        @Test
        @DisplayName("Should drop a group whose detectors all weigh zero")
        void shouldDropZeroWeightGroup() {
            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("r1", "muted", 1.0, 1.0, AnomalyType.STATISTICAL),
                    candidate("r2", "muted", 1.0, 1.0, AnomalyType.STATISTICAL),
                    candidate("r2", "classifier", 0.8, 0.5, AnomalyType.BUSINESS)), 0.0, null, NOW);

            assertThat(fused).singleElement().satisfies(a -> {
                assertThat(a.getRecordId()).isEqualTo("r2");
                assertThat(a.getConfidence()).isCloseTo(0.8, within(1e-12));
                assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.BUSINESS);
            });
        }

        @Test
        @DisplayName("Should reject a candidate from a detector without a weight")
        void shouldRejectUnknownDetector() {
            List<AnomalyCandidate> candidates = List.of(
                    candidate("r1", "stranger", 0.9, 1.0, AnomalyType.STATISTICAL));

            assertThatThrownBy(() -> engine.fuse(candidates, 0.7, null, NOW))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("stranger");
        }

        @Test
        @DisplayName("Should return nothing for no candidates")
        void shouldHandleEmptyInput() {
            assertThat(engine.fuse(List.of(), 0.7, null, NOW)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Type vote")
    class TypeVote {

        @Test
        @DisplayName("Should break a tied vote in favour of the rule detector")
        void shouldPreferRuleDetectorOnTie() {
            FusionEngine tied = new FusionEngine(new SeverityPolicy(), Map.of("forest", 0.3, "rules", 0.3),
                    Set.of("rules"));

            List<IntegratedAnomaly> fused = tied.fuse(List.of(
                    candidate("r1", "forest", 0.9, 0.9, AnomalyType.STATISTICAL),
                    candidate("r1", "rules", 0.9, 1.0, AnomalyType.BUSINESS)), 0.7, null, NOW);

            assertThat(fused.get(0).getAnomalyType()).isEqualTo(AnomalyType.BUSINESS);
        }

        @Test
        @DisplayName("Should fall back to type declaration order without a rule detector")
        void shouldUseDeclarationOrderOnTie() {
            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("r1", "forest", 0.9, 0.9, AnomalyType.PATTERN),
                    candidate("r1", "dbscan", 0.9, 1.0, AnomalyType.STATISTICAL)), 0.7, null, NOW);

            assertThat(fused.get(0).getAnomalyType()).isEqualTo(AnomalyType.STATISTICAL);
        }

        @Test
        @DisplayName("Should use rule-heuristic detectors as tie-breakers when built from configuration")
        void shouldDeriveTieBreakersFromConfiguration() {
            FusionEngine configured = FusionEngine.forDetectors(List.of(
                    new DetectorConfig("forest", DetectorType.OUTLIER_ENSEMBLE, 0.5, 0.5),
                    new DetectorConfig("checks", DetectorType.RULE_HEURISTIC, 0.5, 0.5)), new SeverityPolicy());

            List<IntegratedAnomaly> fused = configured.fuse(List.of(
                    candidate("r1", "forest", 0.9, 0.9, AnomalyType.STATISTICAL),
                    candidate("r1", "checks", 0.9, 1.0, AnomalyType.BUSINESS)), 0.7, null, NOW);

            assertThat(fused.get(0).getAnomalyType()).isEqualTo(AnomalyType.BUSINESS);
        }
    }

    @Nested
    @DisplayName("Union")
    class Union {

        @Test
        @DisplayName("Should keep the strongest candidate per record without a minimum")
        void shouldKeepStrongestCandidate() {
            List<IntegratedAnomaly> merged = engine.union(List.of(
                    candidate("r1", "forest", 0.6, 0.7, AnomalyType.STATISTICAL),
                    candidate("r1", "dbscan", 0.8, 1.0, AnomalyType.PATTERN),
                    candidate("r2", "forest", 0.2, 0.3, AnomalyType.STATISTICAL)), null, NOW);

            assertThat(merged).extracting(IntegratedAnomaly::getRecordId).containsExactly("r1", "r2");
            IntegratedAnomaly first = merged.get(0);
            assertThat(first.getConfidence()).isEqualTo(0.8);
            assertThat(first.getCombinedScore()).isEqualTo(1.0);
            assertThat(first.getAnomalyType()).isEqualTo(AnomalyType.PATTERN);
            assertThat(first.getContributingDetectors()).containsExactly("dbscan", "forest");
            assertThat(merged.get(1).getSeverity()).isEqualTo(Severity.LOW);
        }

        @Test
        @DisplayName("Should ignore weights, even unknown detectors")
        void shouldIgnoreWeights() {
            List<IntegratedAnomaly> merged = engine.union(List.of(
                    candidate("r1", "stranger", 0.6, 0.7, AnomalyType.STATISTICAL)), null, NOW);

            assertThat(merged).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Explanation and context")
    class ExplanationAndContext {

        @Test
        @DisplayName("Should name every contributing detector in the explanation")
        void shouldExplain() {
            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("r1", "rules", 0.9, 1.0, AnomalyType.BUSINESS),
                    candidate("r1", "forest", 0.9, 0.8, AnomalyType.STATISTICAL)), 0.7, null, NOW);

            assertThat(fused.get(0).getExplanation()).isEqualTo(
                    "Flagged by 2 detectors (forest, rules): forest: explained by forest; rules: explained by rules");
        }

        @Test
        @DisplayName("Should snapshot the record and its features")
        void shouldSnapshotContext() {
            FeatureBatch batch = SampleRecords.build(SampleRecords.ledger());

            List<IntegratedAnomaly> fused = engine.fuse(List.of(
                    candidate("2", "rules", 0.9, 1.0, AnomalyType.BUSINESS)), 0.7, batch, NOW);

            Map<String, Object> context = fused.get(0).getContext();
            assertThat(context).containsKeys(FusionEngine.CONTEXT_RECORD, FusionEngine.CONTEXT_FEATURES);
            assertThat(context.get(FusionEngine.CONTEXT_FEATURE_COUNT)).isEqualTo(12);
            assertThat(context.get(FusionEngine.CONTEXT_DETECTED_AT)).isEqualTo("2024-06-01T12:00:00Z");
            @SuppressWarnings("unchecked")
            Map<String, Object> record = (Map<String, Object>) context.get(FusionEngine.CONTEXT_RECORD);
            assertThat(record).containsEntry("account", "1002");
            @SuppressWarnings("unchecked")
            Map<String, Double> features = (Map<String, Double>) context.get(FusionEngine.CONTEXT_FEATURES);
            assertThat(features).containsEntry("amount", 15_000_000d);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyCandidate candidate(String recordId, String detector, double confidence, double raw,
            AnomalyType type) {
        return AnomalyCandidate.builder()
                .recordId(recordId)
                .detectorName(detector)
                .confidence(confidence)
                .rawScore(raw)
                .anomalyType(type)
                .explanation("explained by " + detector)
                .build();
    }
}
