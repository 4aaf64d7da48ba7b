package com.vmsentinel.core.classification;

import com.vmsentinel.core.model.Alert;
import com.vmsentinel.core.model.AlertRule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether one rule fires over one metric series.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: everything they need arrives
 * with each call, so one instance per {@link com.vmsentinel.core.model.Condition}
 * serves every rule and thread.
 * </p>
 */
public interface RuleEvaluator {

    /**
     * Evaluate {@code rule} against the values of its metric.
     *
     * @param rule   the rule being evaluated
     * @param values the rule's metric series, never empty
     * @param entity monitored entity name, copied into the alert
     * @param asOf   timestamp recorded on the alert
     * @return an {@link Alert} if the rule fires, empty otherwise
     */
    Optional<Alert> evaluate(AlertRule rule, List<Double> values, String entity, Instant asOf);
}
