package com.auditsentinel.core.store;

import com.auditsentinel.core.model.AnomalyType;
import com.auditsentinel.core.model.DetectionRun;
import com.auditsentinel.core.model.DetectorPerformance;
import com.auditsentinel.core.model.DetectorRunResult;
import com.auditsentinel.core.model.DetectorStatus;
import com.auditsentinel.core.model.ExpertFeedback;
import com.auditsentinel.core.model.FeedbackType;
import com.auditsentinel.core.model.IntegratedAnomaly;
import com.auditsentinel.core.model.ReportStatus;
import com.auditsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour every {@link ResultStore} shares.
 */
abstract class AbstractResultStoreTest {

    protected static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    protected ResultStore store;

    protected abstract ResultStore createStore();

    @BeforeEach
    void createFreshStore() {
        store = createStore();
    }

    @Test
    @DisplayName("Should return empty results for a fresh store")
    void shouldStartEmpty() {
        assertThat(store.listRuns()).isEmpty();
        assertThat(store.findAnomalies("run-1")).isEmpty();
        assertThat(store.findAnomaly("anomaly-1")).isEmpty();
        assertThat(store.listPerformance()).isEmpty();
        assertThat(store.listFeedback()).isEmpty();
    }

    @Test
    @DisplayName("Should append and list runs in order")
    void shouldAppendRuns() {
        store.appendRun(run("run-1"));
        store.appendRun(run("run-2"));

        assertThat(store.listRuns()).extracting(DetectionRun::getRunId).containsExactly("run-1", "run-2");
        DetectionRun first = store.listRuns().get(0);
        assertThat(first.getStatus()).isEqualTo(ReportStatus.SUCCESS);
        assertThat(first.getDetectorsUsed()).containsExactly("rules", "forest");
        assertThat(first.getPerformanceMetrics()).containsEntry("anomaly_rate", 0.2);
        assertThat(first.getStartedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should find anomalies by run and by id")
    void shouldFindAnomalies() {
        store.appendAnomalies(List.of(anomaly("run-1", "anomaly-1", "r1"), anomaly("run-1", "anomaly-2", "r2")));
        store.appendAnomalies(List.of(anomaly("run-2", "anomaly-3", "r1")));

        assertThat(store.findAnomalies("run-1")).extracting(IntegratedAnomaly::getAnomalyId)
                .containsExactly("anomaly-1", "anomaly-2");
        assertThat(store.findAnomaly("anomaly-3")).hasValueSatisfying(a -> {
            assertThat(a.getRunId()).isEqualTo("run-2");
            assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.BUSINESS);
            assertThat(a.getContributingDetectors()).containsExactly("forest", "rules");
            assertThat(a.getDetectedAt()).isEqualTo(NOW);
        });
    }

    @Test
    @DisplayName("Should store detector performance")
    void shouldAppendPerformance() {
        DetectorRunResult result = DetectorRunResult.failed("forest", "boom", NOW, 12L);

        store.appendPerformance(List.of(new DetectorPerformance("run-1", result, 5)));

        assertThat(store.listPerformance()).singleElement().satisfies(p -> {
            assertThat(p.getDetectorName()).isEqualTo("forest");
            assertThat(p.getStatus()).isEqualTo(DetectorStatus.FAILED);
            assertThat(p.getDatasetSize()).isEqualTo(5);
            assertThat(p.getExecutionTimeMs()).isEqualTo(12L);
        });
    }

    @Test
    @DisplayName("Should find feedback by anomaly id")
    void shouldAppendFeedback() {
        store.appendFeedback(feedback("f1", "anomaly-1", FeedbackType.CONFIRMED));
        store.appendFeedback(feedback("f2", "anomaly-2", FeedbackType.FALSE_POSITIVE));
        store.appendFeedback(feedback("f3", "anomaly-1", FeedbackType.NEEDS_REVIEW));

        assertThat(store.findFeedback("anomaly-1")).extracting(ExpertFeedback::getFeedbackType)
                .containsExactly(FeedbackType.CONFIRMED, FeedbackType.NEEDS_REVIEW);
        assertThat(store.listFeedback()).hasSize(3);
    }

    @Test
    @DisplayName("Should ignore an empty append")
    void shouldIgnoreEmptyAppend() {
        store.appendAnomalies(List.of());

        assertThat(store.findAnomalies("run-1")).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    protected static DetectionRun run(String runId) {
        return new DetectionRun(runId, NOW, NOW.plusSeconds(1), ReportStatus.SUCCESS, 5, 1,
                List.of("rules", "forest"), Map.of("anomaly_rate", 0.2));
    }

    protected static IntegratedAnomaly anomaly(String runId, String anomalyId, String recordId) {
        return IntegratedAnomaly.builder()
                .runId(runId)
                .anomalyId(anomalyId)
                .recordId(recordId)
                .anomalyType(AnomalyType.BUSINESS)
                .confidence(0.85)
                .combinedScore(1.0)
                .severity(Severity.HIGH)
                .contributingDetectors(List.of("forest", "rules"))
                .explanation("Flagged by 2 detectors")
                .context(Map.of("detectedAt", NOW.toString()))
                .detectedAt(NOW)
                .build();
    }

    protected static ExpertFeedback feedback(String feedbackId, String anomalyId, FeedbackType type) {
        return new ExpertFeedback(feedbackId, anomalyId, type, "auditor", null, NOW);
    }
}
