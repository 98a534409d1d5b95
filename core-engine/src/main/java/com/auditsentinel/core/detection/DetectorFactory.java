package com.auditsentinel.core.detection;

import com.auditsentinel.core.exception.ConfigurationException;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link DetectorConfig}s.
 *
 * <p>
 * Each {@link DetectorType} maps to one constructor. Adding a detector means
 * adding a type constant and registering its constructor here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private static final Map<DetectorType, BiFunction<DetectorConfig, Double, AnomalyDetector>> CONSTRUCTORS;

    static {
        Map<DetectorType, BiFunction<DetectorConfig, Double, AnomalyDetector>> map =
                new EnumMap<>(DetectorType.class);
        map.put(DetectorType.OUTLIER_ENSEMBLE, OutlierEnsembleDetector::new);
        map.put(DetectorType.DENSITY_CLUSTER, (config, contamination) -> new DensityClusterDetector(config));
        map.put(DetectorType.SUPERVISED_CLASSIFIER,
                (config, contamination) -> new SupervisedClassifierDetector(config));
        map.put(DetectorType.RECONSTRUCTION_ERROR, ReconstructionErrorDetector::new);
        map.put(DetectorType.RULE_HEURISTIC, (config, contamination) -> new RuleHeuristicDetector(config));
        CONSTRUCTORS = Collections.unmodifiableMap(map);
    }

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector.
     *
     * @param config        detector configuration; must not be {@code null}
     * @param contamination expected anomaly share, used by the unsupervised
     *                      detectors to derive cutoffs
     * @return the detector
     * @throws ConfigurationException if the type is unknown or a parameter is
     *                                invalid
     */
    public static AnomalyDetector create(DetectorConfig config, double contamination) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        DetectorType type = DetectorType.fromConfigName(config.getType())
                .orElseThrow(() -> new ConfigurationException("Unknown detector type: '" + config.getType()
                        + "'. Supported types: " + DetectorType.supportedNames()));
        try {
            return CONSTRUCTORS.get(type).apply(config, contamination);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid parameters for detector '" + config.getName() + "': "
                    + e.getMessage(), e);
        }
    }

    /**
     * Create detectors for every configuration in the list.
     *
     * @return unmodifiable list of detectors, one per configuration
     */
    public static List<AnomalyDetector> createAll(List<DetectorConfig> configs, double contamination) {
        Objects.requireNonNull(configs, "Detector list must not be null");
        LOG.debug("Creating {} detector(s) from configuration", configs.size());
        return configs.stream()
                .map(c -> create(c, contamination))
                .toList();
    }
}
