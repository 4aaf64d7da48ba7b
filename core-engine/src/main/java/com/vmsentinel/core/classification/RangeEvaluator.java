package com.vmsentinel.core.classification;

import com.vmsentinel.core.model.Alert;
import com.vmsentinel.core.model.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Whole-window range check.
 *
 * <p>
 * Fires only when <em>every</em> value lies in {@code [low, high]}; the rule's
 * {@code timeFraction} is ignored. A single value outside the range, anywhere in
 * the window, suppresses the alert. The triggering value is the mean of the
 * whole series.
 * </p>
 *
 * @since 1.0.0
 */
public class RangeEvaluator implements RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RangeEvaluator.class);

    @Override
    public Optional<Alert> evaluate(AlertRule rule, List<Double> values, String entity, Instant asOf) {
        double low = rule.getThresholds().getLow();
        double high = rule.getThresholds().getHigh();

        double sum = 0;
        for (double v : values) {
            if (!(v >= low && v <= high)) {
                LOG.trace("Rule [{}] not fired: value {} outside [{}, {}]", rule.getName(), v, low, high);
                return Optional.empty();
            }
            sum += v;
        }

        double mean = sum / values.size();
        LOG.debug("Rule [{}] fired for {}: all {} value(s) within [{}, {}], mean={}",
                rule.getName(), entity, values.size(), low, high, mean);

        return Optional.of(Alert.builder()
                .rule(rule)
                .triggeringValue(mean)
                .timestamp(asOf)
                .entity(entity)
                .message(String.format(Locale.ROOT, "%s: %.1f%% (range: %s-%s%%)",
                        rule.getDescription(), mean,
                        FractionThresholdEvaluator.formatBound(low),
                        FractionThresholdEvaluator.formatBound(high)))
                .build());
    }
}
