package com.auditsentinel.core.detection.model;

import com.auditsentinel.core.exception.ConfigurationException;
import com.auditsentinel.core.json.JsonMappers;
import com.auditsentinel.core.model.FeatureVector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link LogisticClassifier}.
 */
class LogisticClassifierTest {

    private final ObjectMapper mapper = JsonMappers.create();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should apply the logistic function to the linear score")
    void shouldComputeProbability() {
        LogisticClassifier classifier = new LogisticClassifier(Map.of("a", 2.0), -1.0);

        assertThat(classifier.probability(vector(List.of("a"), 0.5))).isCloseTo(0.5, within(1e-12));
        assertThat(classifier.probability(vector(List.of("a"), 3.0)))
                .isCloseTo(1 / (1 + Math.exp(-5.0)), within(1e-12));
    }

    @Test
    @DisplayName("Should ignore coefficients for features the batch does not have")
    void shouldIgnoreMissingFeatures() {
        LogisticClassifier classifier = new LogisticClassifier(Map.of("a", 1.0, "missing", 100.0), 0.0);

        assertThat(classifier.probability(vector(List.of("a"), 0.0))).isCloseTo(0.5, within(1e-12));
    }

    @Test
    @DisplayName("Should load a model from JSON")
    void shouldLoadFromJson() throws URISyntaxException {
        Path path = Path.of(getClass().getClassLoader().getResource("classifier-model.json").toURI());

        LogisticClassifier classifier = LogisticClassifier.load(path, mapper);

        assertThat(classifier.getCoefficients()).containsEntry("amount_zscore", 4.0);
        assertThat(classifier.getIntercept()).isEqualTo(-3.0);
    }

    @Test
    @DisplayName("Should fail with a configuration error for a missing file")
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> LogisticClassifier.load(tempDir.resolve("none.json"), mapper))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should fail with a configuration error for a model without coefficients")
    void shouldFailForEmptyModel() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "{\"coefficients\": {}, \"intercept\": 0}");

        assertThatThrownBy(() -> LogisticClassifier.load(file, mapper))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("at least one coefficient");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static FeatureVector vector(List<String> names, double... values) {
        return new FeatureVector("r1", names, values, Map.of());
    }
}
