/**
 * Exceptions reported synchronously for invalid input.
 *
 * <p>
 * All of them are unchecked. None is transient, so callers should not retry;
 * a failed call never leaves a {@link com.vmsentinel.core.rules.RuleSet}
 * partially modified.
 * </p>
 *
 * @since 1.0.0
 */
package com.vmsentinel.core.error;
