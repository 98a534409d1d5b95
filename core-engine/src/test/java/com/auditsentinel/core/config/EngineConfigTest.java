package com.auditsentinel.core.config;

import com.auditsentinel.core.exception.ConfigurationException;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import com.auditsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfig} and {@link SeverityPolicy}.
 */
class EngineConfigTest {

    @Test
    @DisplayName("Should produce an independent deep copy")
    void shouldDeepCopy() {
        EngineConfig original = new EngineConfig();
        DetectorConfig rules = new DetectorConfig("rules", DetectorType.RULE_HEURISTIC, 0.3, 0.5);
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("ceiling", 100);
        rules.setParameters(parameters);
        original.setDetectors(List.of(rules));

        EngineConfig copy = original.copy();
        rules.setWeight(0.9);
        rules.getParameters().put("ceiling", 5);

        DetectorConfig copied = copy.findDetector("rules").orElseThrow();
        assertThat(copied.getWeight()).isEqualTo(0.3);
        assertThat(copied.doubleParameter("ceiling", 0)).isEqualTo(100);
    }

    @Test
    @DisplayName("Should reject a severity policy with unordered levels")
    void shouldRejectUnorderedSeverity() {
        EngineConfig config = new EngineConfig();
        config.getSeverity().setHighConfidence(0.95);

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("critical >= high >= medium");
    }

    @Test
    @DisplayName("Should classify severity with inclusive bounds, first match wins")
    void shouldClassifySeverity() {
        SeverityPolicy policy = new SeverityPolicy();

        assertThat(policy.classify(0.9, 0.0)).isEqualTo(Severity.CRITICAL);
        assertThat(policy.classify(0.1, 3.0)).isEqualTo(Severity.CRITICAL);
        assertThat(policy.classify(0.8, 0.0)).isEqualTo(Severity.HIGH);
        assertThat(policy.classify(0.0, 2.0)).isEqualTo(Severity.HIGH);
        assertThat(policy.classify(0.7, 0.0)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.classify(0.0, 1.0)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.classify(0.69, 0.99)).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("Should read run options from defaults and detector lists")
    void shouldBuildRunConfigs() {
        RunConfig defaults = RunConfig.defaults();
        assertThat(defaults.getDetectors()).isEmpty();
        assertThat(defaults.isUseEnsemble()).isTrue();
        assertThat(defaults.getMinConfidence()).isNull();
        assertThat(defaults.isPersist()).isTrue();

        assertThat(RunConfig.forDetectors("a", "b").getDetectors()).containsExactly("a", "b");
    }
}
