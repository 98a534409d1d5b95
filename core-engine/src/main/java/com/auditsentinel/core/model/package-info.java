/**
 * Domain model of the audit anomaly engine.
 *
 * <p>
 * Records come in, {@link com.auditsentinel.core.model.FeatureVector}s and
 * {@link com.auditsentinel.core.model.AnomalyCandidate}s live for one run,
 * and {@link com.auditsentinel.core.model.IntegratedAnomaly},
 * {@link com.auditsentinel.core.model.DetectionRun} and
 * {@link com.auditsentinel.core.model.ExpertFeedback} outlive the call through
 * the result store.
 * </p>
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.model;
