package com.auditsentinel.core.detection;

import com.auditsentinel.core.SampleRecords;
import com.auditsentinel.core.detection.model.ModelHandles;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.AnomalyType;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link OutlierEnsembleDetector}.
 */
class OutlierEnsembleDetectorTest {

    @Test
    @DisplayName("Should flag the extreme record with the highest confidence")
    void shouldFlagExtremeRecord() {
        OutlierEnsembleDetector detector = new OutlierEnsembleDetector(config(Map.of()), 0.1);
        FeatureBatch batch = SampleRecords.build(SampleRecords.quantities(40, 10_000));

        List<AnomalyCandidate> candidates = detector.detect(batch, ModelHandles.none());

        assertThat(candidates).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        AnomalyCandidate top = candidates.stream()
                .max(Comparator.comparingDouble(AnomalyCandidate::getConfidence))
                .orElseThrow();
        assertThat(top.getRecordId()).isEqualTo("40");
        assertThat(candidates).allSatisfy(c -> {
            assertThat(c.getAnomalyType()).isEqualTo(AnomalyType.STATISTICAL);
            assertThat(c.getConfidence()).isGreaterThan(0.5).isLessThanOrEqualTo(1.0);
            assertThat(c.getRawScore()).isLessThanOrEqualTo(top.getRawScore());
        });
    }

    @Test
    @DisplayName("Should produce identical candidates for the same seed")
    void shouldBeReproducible() {
        FeatureBatch batch = SampleRecords.build(SampleRecords.quantities(40, 10_000));

        List<AnomalyCandidate> first = new OutlierEnsembleDetector(config(Map.of("seed", 3)), 0.1)
                .detect(batch, ModelHandles.none());
        List<AnomalyCandidate> second = new OutlierEnsembleDetector(config(Map.of("seed", 3)), 0.1)
                .detect(batch, ModelHandles.none());

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should return nothing for a single record")
    void shouldSkipSingleRecord() {
        OutlierEnsembleDetector detector = new OutlierEnsembleDetector(config(Map.of()), 0.1);
        FeatureBatch batch = SampleRecords.build(SampleRecords.quantities(0, 5));

        assertThat(detector.detect(batch, ModelHandles.none())).isEmpty();
    }

    @Test
    @DisplayName("Should reject contamination outside (0, 0.5]")
    void shouldRejectBadContamination() {
        assertThatThrownBy(() -> new OutlierEnsembleDetector(config(Map.of()), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OutlierEnsembleDetector(config(Map.of()), 0.6))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectorConfig config(Map<String, Object> parameters) {
        DetectorConfig config = new DetectorConfig("forest", DetectorType.OUTLIER_ENSEMBLE, 0.3, 0.5);
        config.setParameters(parameters);
        return config;
    }
}
