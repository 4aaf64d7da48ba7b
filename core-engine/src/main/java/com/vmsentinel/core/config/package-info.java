/**
 * Configuration: the YAML rule catalogue and environment-driven analysis defaults.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.vmsentinel.core.config.RulesLoader} into a
 * {@link com.vmsentinel.core.config.RulesConfig}, which validates itself and
 * converts into a {@link com.vmsentinel.core.rules.RuleSet}.
 * {@link com.vmsentinel.core.config.AnalysisSettings} carries the gap-analysis
 * and enrichment defaults.
 * </p>
 *
 * @since 1.0.0
 */
package com.vmsentinel.core.config;
