package com.vmsentinel.core.classification;

import com.vmsentinel.core.model.AlertRule;

/**
 * Fires when enough values are strictly below {@code thresholds.low}.
 *
 * @since 1.0.0
 */
public class LessThanEvaluator extends FractionThresholdEvaluator {

    @Override
    protected double threshold(AlertRule rule) {
        return rule.getThresholds().getLow();
    }

    @Override
    protected boolean matches(double value, double threshold) {
        return value < threshold;
    }
}
