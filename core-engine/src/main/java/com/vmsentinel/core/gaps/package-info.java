/**
 * Sampling gap detection and completeness measurement.
 *
 * @since 1.0.0
 */
package com.vmsentinel.core.gaps;
