package com.auditsentinel.server;

import com.auditsentinel.core.config.EngineConfig;
import com.auditsentinel.core.config.EngineConfigLoader;
import com.auditsentinel.core.detection.model.LogisticClassifier;
import com.auditsentinel.core.detection.model.ModelRegistry;
import com.auditsentinel.core.engine.DetectionCoordinator;
import com.auditsentinel.core.json.JsonMappers;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import com.auditsentinel.core.store.InMemoryResultStore;
import com.auditsentinel.core.store.JsonLinesResultStore;
import com.auditsentinel.core.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point of the Audit Sentinel detection server.
 *
 * <h3>Startup</h3>
 *
 * <pre>
 *   ServerConfig (environment)
 *     → EngineConfig (ENGINE_CONFIG_PATH or classpath engine.yml)
 *     → ResultStore (JSON lines under RESULT_STORE_DIR, else in memory)
 *     → ModelRegistry (classifier from CLASSIFIER_MODEL_PATH, if any)
 *     → DetectionCoordinator
 *     → DetectionServer
 * </pre>
 *
 * @since 1.0.0
 */
public final class AuditSentinelServer {

    private static final Logger LOG = LoggerFactory.getLogger(AuditSentinelServer.class);

    private AuditSentinelServer() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServerConfig config = ServerConfig.fromEnvironment();
        LOG.info("Starting Audit Sentinel with config: {}", config);

        // 2. Wire the engine
        DetectionCoordinator coordinator = createCoordinator(config);

        // 3. Serve, and shut both down together
        DetectionServer server = new DetectionServer(coordinator);
        server.start(config.getPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            coordinator.close();
        }, "server-shutdown"));
    }

    // ---------------------------------------------------------------
    // Assembly (extracted for testability)
    // ---------------------------------------------------------------

    static DetectionCoordinator createCoordinator(ServerConfig config) {
        EngineConfig engineConfig = loadEngineConfig(config);
        if (engineConfig.getDetectors().isEmpty()) {
            throw new IllegalStateException(
                    "No detectors defined. Provide them via " + ServerConfig.ENV_ENGINE_CONFIG_PATH
                            + " or a classpath " + EngineConfigLoader.DEFAULT_RESOURCE + " file.");
        }
        LOG.info("Loaded {} detector configuration(s)", engineConfig.getDetectors().size());

        return new DetectionCoordinator(engineConfig, loadModels(config, engineConfig), createStore(config));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EngineConfig loadEngineConfig(ServerConfig config) {
        if (config.hasEngineConfigPath()) {
            return EngineConfigLoader.fromFile(config.getEngineConfigPath());
        }
        return EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);
    }

    private static ResultStore createStore(ServerConfig config) {
        if (config.isPersistentStore()) {
            return new JsonLinesResultStore(Path.of(config.getResultStoreDir()));
        }
        LOG.warn("{} not set; results are kept in memory only", ServerConfig.ENV_RESULT_STORE_DIR);
        return new InMemoryResultStore();
    }

    private static ModelRegistry loadModels(ServerConfig config, EngineConfig engineConfig) {
        ModelRegistry models = new ModelRegistry();
        if (!config.hasClassifierModel()) {
            return models;
        }
        LogisticClassifier classifier = LogisticClassifier.load(Path.of(config.getClassifierModelPath()),
                JsonMappers.create());
        String classifierType = DetectorType.SUPERVISED_CLASSIFIER.getConfigName();
        for (DetectorConfig detector : engineConfig.getDetectors()) {
            if (classifierType.equals(detector.getType())) {
                models.register(detector.getName(), classifier);
            }
        }
        return models;
    }
}
