/**
 * Shared Jackson configuration.
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.json;
