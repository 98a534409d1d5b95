/**
 * The {@link com.auditsentinel.core.engine.DetectionCoordinator} facade that
 * drives a detection run end to end.
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.engine;
