/**
 * Conversion of raw audit records into fixed-schema numeric features, and the
 * batch statistics shared with the detectors.
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.feature;
