/**
 * Engine configuration loading and validation.
 *
 * <p>
 * The engine is configured in YAML and loaded by
 * {@link com.auditsentinel.core.config.EngineConfigLoader} into an
 * {@link com.auditsentinel.core.config.EngineConfig}; validation runs right
 * after parsing. {@link com.auditsentinel.core.config.RunConfig} carries the
 * per-call options.
 * </p>
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.config;
