package com.vmsentinel.core.classification;

import com.vmsentinel.core.model.AlertRule;

/**
 * Fires when enough values are strictly above {@code thresholds.high}.
 *
 * @since 1.0.0
 */
public class GreaterThanEvaluator extends FractionThresholdEvaluator {

    @Override
    protected double threshold(AlertRule rule) {
        return rule.getThresholds().getHigh();
    }

    @Override
    protected boolean matches(double value, double threshold) {
        return value > threshold;
    }
}
