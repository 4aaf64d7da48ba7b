/**
 * Value types shared by the gap analyzer and the status classifier.
 *
 * <ul>
 * <li>{@link com.vmsentinel.core.model.Sample}: one recorded metric value</li>
 * <li>{@link com.vmsentinel.core.model.MetricWindow}: aligned per-metric series
 * used as the unit of rule evaluation</li>
 * <li>{@link com.vmsentinel.core.model.AlertRule} and
 * {@link com.vmsentinel.core.model.RuleUpdate}: rule definition and its
 * partial update</li>
 * <li>{@link com.vmsentinel.core.model.Alert},
 * {@link com.vmsentinel.core.model.StatusReport},
 * {@link com.vmsentinel.core.model.GapReport}: results handed to callers</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.vmsentinel.core.model;
