/**
 * Model implementations behind the statistical detectors: isolation forest,
 * DBSCAN, PCA reconstruction and a fitted logistic classifier, plus the
 * {@link com.auditsentinel.core.detection.model.ModelRegistry} that hands
 * fitted models to runs.
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.detection.model;
