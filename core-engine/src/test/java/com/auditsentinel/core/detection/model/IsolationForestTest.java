package com.auditsentinel.core.detection.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationForest} and the path-length normaliser.
 */
class IsolationForestTest {

    @Test
    @DisplayName("Should use the harmonic approximation for the average path length")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationNode.averagePathLength(0)).isZero();
        assertThat(IsolationNode.averagePathLength(1)).isZero();
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
        double expected = 2 * (Math.log(255) + 0.5772156649015329) - 2.0 * 255 / 256;
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(expected, within(1e-12));
    }

    @Test
    @DisplayName("Should score an isolated point above the cluster")
    void shouldScoreOutlierHigher() {
        double[][] data = cluster(50);
        data[data.length - 1] = new double[] { 40.0, -40.0 };

        IsolationForest forest = IsolationForest.train(data, 100, 256, 42L);
        double[] scores = forest.anomalyScores(data);

        double outlier = scores[data.length - 1];
        for (int i = 0; i < data.length - 1; i++) {
            assertThat(scores[i]).isLessThan(outlier);
        }
        assertThat(outlier).isGreaterThan(0.6).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Should be deterministic for a fixed seed")
    void shouldBeDeterministic() {
        double[][] data = cluster(30);

        double[] first = IsolationForest.train(data, 20, 16, 7L).anomalyScores(data);
        double[] second = IsolationForest.train(data, 20, 16, 7L).anomalyScores(data);

        assertThat(first).containsExactly(second);
    }

    @Test
    @DisplayName("Should cap the sample size at the batch size")
    void shouldCapSampleSize() {
        IsolationForest forest = IsolationForest.train(cluster(10), 5, 256, 1L);

        assertThat(forest.getSampleSize()).isEqualTo(10);
        assertThat(forest.getTreeCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should score zero when trained on a single row")
    void shouldScoreZeroForSingleRow() {
        IsolationForest forest = IsolationForest.train(new double[][] { { 1.0 } }, 10, 256, 1L);

        assertThat(forest.anomalyScore(new double[] { 5.0 })).isZero();
    }

    @Test
    @DisplayName("Should attribute the anomaly to the deviating feature")
    void shouldAttributeContributions() {
        double[][] data = cluster(50);
        data[data.length - 1] = new double[] { 40.0, 0.5 };
        IsolationForest forest = IsolationForest.train(data, 100, 256, 42L);

        double[] contributions = forest.featureContributions(data[data.length - 1], new double[] { 0.5, 0.5 });

        assertThat(contributions).hasSize(2);
        assertThat(contributions[0]).isGreaterThan(contributions[1]);
        assertThat(contributions[1]).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("Should reject an empty training set")
    void shouldRejectEmptyData() {
        assertThatThrownBy(() -> IsolationForest.train(new double[0][], 10, 10, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Points on a small grid in [0, 1) x [0, 1). */
    private static double[][] cluster(int size) {
        double[][] data = new double[size][];
        for (int i = 0; i < size; i++) {
            data[i] = new double[] { (i % 7) / 7.0, (i % 5) / 5.0 };
        }
        return data;
    }
}
