package com.auditsentinel.core.detection.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Dbscan}.
 */
class DbscanTest {

    @Test
    @DisplayName("Should find two clusters and one noise point")
    void shouldClusterAndMarkNoise() {
        double[][] data = {
                { 0.0, 0.0 }, { 0.1, 0.0 }, { 0.0, 0.1 },
                { 5.0, 5.0 }, { 5.1, 5.0 }, { 5.0, 5.1 },
                { 10.0, -10.0 }
        };

        int[] labels = new Dbscan(0.5, 3).fit(data);

        assertThat(labels[0]).isEqualTo(labels[1]).isEqualTo(labels[2]).isNotEqualTo(Dbscan.NOISE);
        assertThat(labels[3]).isEqualTo(labels[4]).isEqualTo(labels[5]).isNotEqualTo(labels[0]);
        assertThat(labels[6]).isEqualTo(Dbscan.NOISE);
    }

    @Test
    @DisplayName("Should count the point itself toward minSamples")
    void shouldCountSelf() {
        double[][] pair = { { 0.0 }, { 0.2 } };

        assertThat(new Dbscan(0.5, 2).fit(pair)).containsExactly(0, 0);
        assertThat(new Dbscan(0.5, 3).fit(pair)).containsExactly(Dbscan.NOISE, Dbscan.NOISE);
    }

    @Test
    @DisplayName("Should absorb border points into the cluster")
    void shouldAbsorbBorderPoints() {
        double[][] chain = { { 0.0 }, { 0.4 }, { 0.8 }, { 1.2 } };

        int[] labels = new Dbscan(0.45, 3).fit(chain);

        assertThat(labels).containsExactly(0, 0, 0, 0);
    }

    @Test
    @DisplayName("Should keep identical rows in the same cluster")
    void shouldClusterDuplicateRows() {
        double[][] data = { { 1.0, 1.0 }, { 1.0, 1.0 }, { 1.0, 1.0 }, { 9.0, 9.0 } };

        int[] labels = new Dbscan(0.5, 3).fit(data);

        assertThat(labels).containsExactly(0, 0, 0, Dbscan.NOISE);
    }

    @Test
    @DisplayName("Should treat every point as a core point when minSamples is 1")
    void shouldHaveNoNoiseWithSingleSample() {
        double[][] data = { { 0.0 }, { 3.0 }, { 6.0 } };

        assertThat(new Dbscan(0.5, 1).fit(data)).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new Dbscan(0, 3)).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("eps must be > 0");
        assertThatThrownBy(() -> new Dbscan(0.5, 0)).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minSamples must be >= 1");
    }
}
