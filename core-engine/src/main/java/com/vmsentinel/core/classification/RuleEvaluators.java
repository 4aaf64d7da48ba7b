package com.vmsentinel.core.classification;

import com.vmsentinel.core.model.Condition;

import java.util.Objects;

/**
 * Maps each {@link Condition} to its {@link RuleEvaluator}.
 *
 * <p>
 * The switch is exhaustive over {@code Condition}: adding a condition without
 * an evaluator is a compile error.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleEvaluators {

    private static final RuleEvaluator GREATER_THAN = new GreaterThanEvaluator();
    private static final RuleEvaluator LESS_THAN = new LessThanEvaluator();
    private static final RuleEvaluator RANGE = new RangeEvaluator();

    private RuleEvaluators() {
        // utility class
    }

    /**
     * @param condition rule condition; must not be {@code null}
     * @return the shared evaluator for that condition
     */
    public static RuleEvaluator forCondition(Condition condition) {
        Objects.requireNonNull(condition, "Condition must not be null");
        return switch (condition) {
            case GREATER_THAN -> GREATER_THAN;
            case LESS_THAN -> LESS_THAN;
            case RANGE -> RANGE;
        };
    }
}
