/**
 * Rule configuration: the shared, updatable {@link com.vmsentinel.core.rules.RuleSet}
 * and the default catalogue in {@link com.vmsentinel.core.rules.DefaultRules}.
 *
 * @since 1.0.0
 */
package com.vmsentinel.core.rules;
