/**
 * HTTP detection server for Audit Sentinel.
 *
 * <p>
 * This package wires the core detection engine behind a small JSON-over-HTTP
 * interface: callers post audit record batches, receive the fused anomaly
 * report, and post expert feedback on stored anomalies.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.auditsentinel.server.AuditSentinelServer}: main entry
 * point</li>
 * <li>{@link com.auditsentinel.server.DetectionServer}: HTTP endpoints</li>
 * <li>{@link com.auditsentinel.server.ServerConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.auditsentinel.server;
