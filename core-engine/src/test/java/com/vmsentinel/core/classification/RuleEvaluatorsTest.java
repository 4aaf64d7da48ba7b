package com.vmsentinel.core.classification;

import com.vmsentinel.core.model.Alert;
import com.vmsentinel.core.model.AlertRule;
import com.vmsentinel.core.model.Condition;
import com.vmsentinel.core.model.Severity;
import com.vmsentinel.core.model.Thresholds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the per-condition {@link RuleEvaluator} implementations.
 */
class RuleEvaluatorsTest {

    private static final Instant AS_OF = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Should resolve an evaluator for every condition")
    void shouldResolveEveryCondition() {
        assertThat(RuleEvaluators.forCondition(Condition.GREATER_THAN)).isInstanceOf(GreaterThanEvaluator.class);
        assertThat(RuleEvaluators.forCondition(Condition.LESS_THAN)).isInstanceOf(LessThanEvaluator.class);
        assertThat(RuleEvaluators.forCondition(Condition.RANGE)).isInstanceOf(RangeEvaluator.class);
        assertThatThrownBy(() -> RuleEvaluators.forCondition(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should floor the required match count")
    void shouldFloorRequiredCount() {
        assertThat(FractionThresholdEvaluator.requiredCount(10, 0.2)).isEqualTo(2);
        assertThat(FractionThresholdEvaluator.requiredCount(10, 0.8)).isEqualTo(8);
        assertThat(FractionThresholdEvaluator.requiredCount(4, 0.2)).isZero();
        assertThat(FractionThresholdEvaluator.requiredCount(7, 0.5)).isEqualTo(3);
        assertThat(FractionThresholdEvaluator.requiredCount(5, 1.0)).isEqualTo(5);
        assertThat(FractionThresholdEvaluator.requiredCount(0, 0.8)).isZero();
    }

    @Test
    @DisplayName("Should render bounds without trailing zeros")
    void shouldFormatBounds() {
        assertThat(FractionThresholdEvaluator.formatBound(85.0)).isEqualTo("85");
        assertThat(FractionThresholdEvaluator.formatBound(7.5)).isEqualTo("7.5");
        assertThat(FractionThresholdEvaluator.formatBound(0.0)).isEqualTo("0");
    }

    // ------------------------------------------------------------------
    // Greater-than
    // ------------------------------------------------------------------

    @Nested
    @DisplayName("GreaterThanEvaluator")
    class GreaterThan {

        private final AlertRule rule = rule(Condition.GREATER_THAN, Thresholds.high(80), 0.5);
        private final RuleEvaluator evaluator = new GreaterThanEvaluator();

        @Test
        @DisplayName("Should use strict comparison")
        void shouldCompareStrictly() {
            assertThat(evaluator.evaluate(rule, List.of(80.0, 80.0), "vm", AS_OF)).isEmpty();
        }

        @Test
        @DisplayName("Should report the mean of matching values only")
        void shouldAverageMatchingValues() {
            Optional<Alert> alert = evaluator.evaluate(rule, List.of(82.0, 10.0, 90.0, 20.0), "vm", AS_OF);

            assertThat(alert).isPresent();
            assertThat(alert.get().getTriggeringValue()).isEqualTo(86.0);
            assertThat(alert.get().getTimestamp()).isEqualTo(AS_OF);
            assertThat(alert.get().getMessage()).isEqualTo("test rule: 86.0% (threshold: 80%)");
        }

        @Test
        @DisplayName("Should treat NaN values as non-matching")
        void shouldIgnoreNaN() {
            assertThat(evaluator.evaluate(rule, List.of(Double.NaN, Double.NaN, 90.0, 10.0), "vm", AS_OF))
                    .isEmpty();
        }
    }

    // ------------------------------------------------------------------
    // Less-than
    // ------------------------------------------------------------------

    @Nested
    @DisplayName("LessThanEvaluator")
    class LessThan {

        private final AlertRule rule = rule(Condition.LESS_THAN, Thresholds.low(7.5), 0.5);
        private final RuleEvaluator evaluator = new LessThanEvaluator();

        @Test
        @DisplayName("Should fire once enough values fall below the bound")
        void shouldFireBelowBound() {
            Optional<Alert> alert = evaluator.evaluate(rule, List.of(5.0, 7.0, 7.5, 50.0), "vm", AS_OF);

            assertThat(alert).isPresent();
            assertThat(alert.get().getTriggeringValue()).isEqualTo(6.0);
            assertThat(alert.get().getMessage()).isEqualTo("test rule: 6.0% (threshold: 7.5%)");
        }

        @Test
        @DisplayName("Should use strict comparison")
        void shouldCompareStrictly() {
            assertThat(evaluator.evaluate(rule, List.of(7.5, 7.5, 5.0, 50.0), "vm", AS_OF)).isEmpty();
        }
    }

    // ------------------------------------------------------------------
    // Range
    // ------------------------------------------------------------------

    @Nested
    @DisplayName("RangeEvaluator")
    class Range {

        private final AlertRule rule = rule(Condition.RANGE, Thresholds.range(15, 85), 0.0);
        private final RuleEvaluator evaluator = new RangeEvaluator();

        @Test
        @DisplayName("Should include both bounds")
        void shouldIncludeBounds() {
            Optional<Alert> alert = evaluator.evaluate(rule, List.of(15.0, 85.0), "vm", AS_OF);

            assertThat(alert).isPresent();
            assertThat(alert.get().getTriggeringValue()).isEqualTo(50.0);
            assertThat(alert.get().getMessage()).isEqualTo("test rule: 50.0% (range: 15-85%)");
        }

        @Test
        @DisplayName("Should ignore timeFraction and require every value in range")
        void shouldRequireEveryValue() {
            assertThat(evaluator.evaluate(rule, List.of(50.0, 50.0, 50.0, 14.9), "vm", AS_OF)).isEmpty();
        }

        @Test
        @DisplayName("Should be suppressed by a NaN value")
        void shouldRejectNaN() {
            assertThat(evaluator.evaluate(rule, List.of(50.0, Double.NaN), "vm", AS_OF)).isEmpty();
        }
    }

    private static AlertRule rule(Condition condition, Thresholds thresholds, double timeFraction) {
        return AlertRule.builder()
                .name("test_rule")
                .metric("cpu_usage")
                .condition(condition)
                .thresholds(thresholds)
                .severity(Severity.WARNING)
                .description("test rule")
                .timeFraction(timeFraction)
                .build();
    }
}
