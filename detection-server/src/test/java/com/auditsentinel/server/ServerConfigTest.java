package com.auditsentinel.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServerConfig}.
 */
class ServerConfigTest {

    @Test
    @DisplayName("Should apply defaults when nothing is configured")
    void shouldApplyDefaults() {
        ServerConfig config = new ServerConfig.Builder().build();

        assertThat(config.getPort()).isEqualTo(8080);
        assertThat(config.hasEngineConfigPath()).isFalse();
        assertThat(config.hasClassifierModel()).isFalse();
        assertThat(config.isPersistentStore()).isFalse();
    }

    @Test
    @DisplayName("Should keep every configured value")
    void shouldKeepConfiguredValues() {
        ServerConfig config = new ServerConfig.Builder()
                .port(9090)
                .engineConfigPath("/etc/sentinel/engine.yml")
                .classifierModelPath("/models/classifier.json")
                .resultStoreDir("/var/lib/sentinel")
                .build();

        assertThat(config.getPort()).isEqualTo(9090);
        assertThat(config.getEngineConfigPath()).isEqualTo("/etc/sentinel/engine.yml");
        assertThat(config.getClassifierModelPath()).isEqualTo("/models/classifier.json");
        assertThat(config.getResultStoreDir()).isEqualTo("/var/lib/sentinel");
        assertThat(config.hasEngineConfigPath()).isTrue();
        assertThat(config.hasClassifierModel()).isTrue();
        assertThat(config.isPersistentStore()).isTrue();
    }

    @Test
    @DisplayName("Should treat blank paths as not configured")
    void shouldTreatBlankPathsAsUnset() {
        ServerConfig config = new ServerConfig.Builder()
                .engineConfigPath("  ")
                .resultStoreDir("")
                .build();

        assertThat(config.hasEngineConfigPath()).isFalse();
        assertThat(config.isPersistentStore()).isFalse();
    }

    @Test
    @DisplayName("Should accept port 0 for an ephemeral port")
    void shouldAcceptEphemeralPort() {
        assertThat(new ServerConfig.Builder().port(0).build().getPort()).isZero();
    }

    @Test
    @DisplayName("Should reject out-of-range ports")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> new ServerConfig.Builder().port(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("port must be in [0, 65535]");
        assertThatThrownBy(() -> new ServerConfig.Builder().port(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject null paths")
    void shouldRejectNullPaths() {
        assertThatThrownBy(() -> new ServerConfig.Builder().resultStoreDir(null).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("resultStoreDir");
    }

    @Test
    @DisplayName("Should resolve a valid configuration from the environment")
    void shouldResolveFromEnvironment() {
        ServerConfig config = ServerConfig.fromEnvironment();

        assertThat(config.getPort()).isBetween(0, 65_535);
        assertThat(config.toString()).startsWith("ServerConfig{port=");
    }
}
