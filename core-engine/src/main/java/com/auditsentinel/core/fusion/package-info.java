/**
 * Fusion of detector candidates into ranked, explained anomalies, and
 * attribution of anomalies to features.
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.fusion;
