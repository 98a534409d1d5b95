/**
 * Detectors and their orchestration.
 *
 * <p>
 * All detectors implement the
 * {@link com.auditsentinel.core.detection.AnomalyDetector} interface and are
 * instantiated via {@link com.auditsentinel.core.detection.DetectorFactory}.
 * Built-in detector types:
 * </p>
 * <ul>
 * <li>{@link com.auditsentinel.core.detection.OutlierEnsembleDetector}:
 * isolation forest trained on the batch</li>
 * <li>{@link com.auditsentinel.core.detection.DensityClusterDetector}:
 * DBSCAN noise points</li>
 * <li>{@link com.auditsentinel.core.detection.SupervisedClassifierDetector}:
 * fitted logistic model, skipped when none is registered</li>
 * <li>{@link com.auditsentinel.core.detection.ReconstructionErrorDetector}:
 * PCA reconstruction error</li>
 * <li>{@link com.auditsentinel.core.detection.RuleHeuristicDetector}:
 * auditor rules on monetary fields</li>
 * </ul>
 *
 * <p>
 * {@link com.auditsentinel.core.detection.DetectorRegistry} runs the enabled
 * detectors of a run in parallel and isolates their failures.
 * </p>
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.detection;
