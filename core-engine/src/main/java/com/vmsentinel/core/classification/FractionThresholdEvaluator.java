package com.vmsentinel.core.classification;

import com.vmsentinel.core.model.Alert;
import com.vmsentinel.core.model.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Base for one-sided threshold rules.
 *
 * <p>
 * The rule fires when the number of values beyond the threshold reaches
 * {@code floor(total × timeFraction)}. The alert's triggering value is the mean
 * of the matching values only.
 * </p>
 *
 * @since 1.0.0
 */
abstract class FractionThresholdEvaluator implements RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(FractionThresholdEvaluator.class);

    /**
     * @param rule the rule being evaluated
     * @return the bound this evaluator compares against
     */
    protected abstract double threshold(AlertRule rule);

    /**
     * @param value     one series value
     * @param threshold bound returned by {@link #threshold(AlertRule)}
     * @return whether the value is beyond the bound
     */
    protected abstract boolean matches(double value, double threshold);

    @Override
    public Optional<Alert> evaluate(AlertRule rule, List<Double> values, String entity, Instant asOf) {
        double threshold = threshold(rule);
        int total = values.size();
        int required = requiredCount(total, rule.getTimeFraction());

        int matching = 0;
        double sum = 0;
        for (double v : values) {
            if (matches(v, threshold)) {
                matching++;
                sum += v;
            }
        }

        if (matching < required) {
            LOG.trace("Rule [{}] not fired: {}/{} value(s) matched, {} required",
                    rule.getName(), matching, total, required);
            return Optional.empty();
        }

        // NaN when nothing matched and required == 0
        double mean = sum / matching;
        LOG.debug("Rule [{}] fired for {}: {}/{} value(s) beyond {} (required {}), mean={}",
                rule.getName(), entity, matching, total, threshold, required, mean);

        return Optional.of(Alert.builder()
                .rule(rule)
                .triggeringValue(mean)
                .timestamp(asOf)
                .entity(entity)
                .message(String.format(Locale.ROOT, "%s: %.1f%% (threshold: %s%%)",
                        rule.getDescription(), mean, formatBound(threshold)))
                .build());
    }

    /**
     * @return {@code floor(total × timeFraction)}
     */
    static int requiredCount(int total, double timeFraction) {
        return (int) Math.floor(total * timeFraction);
    }

    /**
     * Render a threshold without trailing zeros ({@code 85}, {@code 7.5}).
     */
    static String formatBound(double bound) {
        if (Double.isNaN(bound) || Double.isInfinite(bound)) {
            return Double.toString(bound);
        }
        return BigDecimal.valueOf(bound).stripTrailingZeros().toPlainString();
    }
}
