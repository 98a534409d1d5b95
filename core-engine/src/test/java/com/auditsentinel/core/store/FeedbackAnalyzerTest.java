package com.auditsentinel.core.store;

import com.auditsentinel.core.model.AnomalyType;
import com.auditsentinel.core.model.ExpertFeedback;
import com.auditsentinel.core.model.FeedbackType;
import com.auditsentinel.core.model.IntegratedAnomaly;
import com.auditsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FeedbackAnalyzer}.
 */
class FeedbackAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private InMemoryResultStore store;
    private FeedbackAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        store = new InMemoryResultStore();
        analyzer = new FeedbackAnalyzer(store);
        store.appendAnomalies(List.of(
                anomaly("a1", "forest", "rules"),
                anomaly("a2", "forest"),
                anomaly("a3", "rules")));
    }

    @Test
    @DisplayName("Should credit every contributing detector with a verdict")
    void shouldSummarisePerDetector() {
        store.appendFeedback(feedback("a1", FeedbackType.CONFIRMED));
        store.appendFeedback(feedback("a2", FeedbackType.FALSE_POSITIVE));
        store.appendFeedback(feedback("a3", FeedbackType.NEEDS_REVIEW));

        Map<String, DetectorFeedbackSummary> summary = analyzer.summarize();

        assertThat(summary).containsOnlyKeys("forest", "rules");
        DetectorFeedbackSummary forest = summary.get("forest");
        assertThat(forest.getConfirmed()).isEqualTo(1);
        assertThat(forest.getFalsePositives()).isEqualTo(1);
        assertThat(forest.getPrecision()).isEqualTo(0.5);
        DetectorFeedbackSummary rules = summary.get("rules");
        assertThat(rules.getTotal()).isEqualTo(2);
        assertThat(rules.getNeedsReview()).isEqualTo(1);
        assertThat(rules.getPrecision()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should ignore feedback on unknown anomalies")
    void shouldIgnoreOrphanedFeedback() {
        store.appendFeedback(feedback("gone", FeedbackType.CONFIRMED));

        assertThat(analyzer.summarize()).isEmpty();
    }

    @Test
    @DisplayName("Should rank the least precise detector first")
    void shouldRankByPrecision() {
        store.appendFeedback(feedback("a1", FeedbackType.CONFIRMED));
        store.appendFeedback(feedback("a2", FeedbackType.FALSE_POSITIVE));

        assertThat(analyzer.rankByPrecision()).extracting(DetectorFeedbackSummary::getDetectorName)
                .containsExactly("forest", "rules");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static IntegratedAnomaly anomaly(String anomalyId, String... detectors) {
        return IntegratedAnomaly.builder()
                .anomalyId(anomalyId)
                .runId("run-1")
                .recordId("r-" + anomalyId)
                .anomalyType(AnomalyType.STATISTICAL)
                .confidence(0.8)
                .severity(Severity.HIGH)
                .contributingDetectors(List.of(detectors))
                .detectedAt(NOW)
                .build();
    }

    private static ExpertFeedback feedback(String anomalyId, FeedbackType type) {
        return new ExpertFeedback("f-" + anomalyId + "-" + type.getValue(), anomalyId, type, "auditor", null, NOW);
    }
}
