/**
 * Rule-based status classification.
 *
 * <p>
 * {@link com.vmsentinel.core.classification.StatusClassifier} walks a
 * {@link com.vmsentinel.core.rules.RuleSet}, dispatching each rule through
 * {@link com.vmsentinel.core.classification.RuleEvaluators} to the evaluator
 * for its condition:
 * </p>
 * <ul>
 * <li>{@link com.vmsentinel.core.classification.GreaterThanEvaluator}: enough
 * values above {@code high}</li>
 * <li>{@link com.vmsentinel.core.classification.LessThanEvaluator}: enough
 * values below {@code low}</li>
 * <li>{@link com.vmsentinel.core.classification.RangeEvaluator}: every value
 * within {@code [low, high]}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.vmsentinel.core.classification;
