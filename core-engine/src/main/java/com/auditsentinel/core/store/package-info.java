/**
 * Persistence of runs, fused anomalies, detector performance and expert
 * feedback, plus the per-detector feedback summary used for manual tuning.
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.store;
