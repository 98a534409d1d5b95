package com.auditsentinel.server;

import java.util.Objects;

/**
 * Typed, immutable configuration of the detection server.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the server can be configured through container env vars or a shell
 * environment alone.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServerConfig {

    public static final String ENV_SERVER_PORT = "SERVER_PORT";
    public static final String ENV_ENGINE_CONFIG_PATH = "ENGINE_CONFIG_PATH";
    public static final String ENV_RESULT_STORE_DIR = "RESULT_STORE_DIR";
    public static final String ENV_CLASSIFIER_MODEL_PATH = "CLASSIFIER_MODEL_PATH";

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------
    private final int port;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String engineConfigPath;
    private final String classifierModelPath;

    // ---------------------------------------------------------------
    // Result store (blank = in memory)
    // ---------------------------------------------------------------
    private final String resultStoreDir;

    private ServerConfig(Builder b) {
        this.port = b.port;
        this.engineConfigPath = b.engineConfigPath;
        this.classifierModelPath = b.classifierModelPath;
        this.resultStoreDir = b.resultStoreDir;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServerConfig fromEnvironment() {
        try {
            return new Builder()
                    .port(Integer.parseInt(env(ENV_SERVER_PORT, "8080")))
                    .engineConfigPath(env(ENV_ENGINE_CONFIG_PATH, ""))
                    .classifierModelPath(env(ENV_CLASSIFIER_MODEL_PATH, ""))
                    .resultStoreDir(env(ENV_RESULT_STORE_DIR, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return TCP port; {@code 0} binds an ephemeral port
     */
    public int getPort() {
        return port;
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public String getClassifierModelPath() {
        return classifierModelPath;
    }

    public String getResultStoreDir() {
        return resultStoreDir;
    }

    public boolean hasEngineConfigPath() {
        return !engineConfigPath.isBlank();
    }

    public boolean hasClassifierModel() {
        return !classifierModelPath.isBlank();
    }

    public boolean isPersistentStore() {
        return !resultStoreDir.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServerConfig}.
     *
     * <p>
     * {@link #build()} checks the port is in [0, 65535] and that no path is
     * {@code null}; blank paths mean "not configured".
     * </p>
     */
    public static class Builder {
        private int port = 8080;
        private String engineConfigPath = "";
        private String classifierModelPath = "";
        private String resultStoreDir = "";

        public Builder port(int v) {
            this.port = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder classifierModelPath(String v) {
            this.classifierModelPath = v;
            return this;
        }

        public Builder resultStoreDir(String v) {
            this.resultStoreDir = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServerConfig build() {
            Objects.requireNonNull(engineConfigPath, "engineConfigPath required");
            Objects.requireNonNull(classifierModelPath, "classifierModelPath required");
            Objects.requireNonNull(resultStoreDir, "resultStoreDir required");

            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("port must be in [0, 65535], got: " + port);
            }
            return new ServerConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "port=" + port +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", classifierModelPath='" + classifierModelPath + '\'' +
                ", resultStoreDir='" + resultStoreDir + '\'' +
                '}';
    }
}
