/**
 * JSON export of analysis results.
 *
 * @since 1.0.0
 */
package com.vmsentinel.core.serialization;
