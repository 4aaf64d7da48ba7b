package com.vmsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertRule} validation and partial updates.
 */
class AlertRuleTest {

    @Test
    @DisplayName("Should collect every validation error in one message")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> AlertRule.builder()
                .condition(Condition.GREATER_THAN)
                .timeFraction(2)
                .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'name' is required")
                .hasMessageContaining("requires 'metric'")
                .hasMessageContaining("requires 'severity'")
                .hasMessageContaining("timeFraction")
                .hasMessageContaining("requires a 'high' threshold");
    }

    @Test
    @DisplayName("Should require a low threshold for lt rules")
    void shouldRequireLowForLessThan() {
        assertThatThrownBy(() -> base().condition(Condition.LESS_THAN).thresholds(Thresholds.high(5)).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires a 'low' threshold");
    }

    @Test
    @DisplayName("Should require both bounds for range rules")
    void shouldRequireBothBoundsForRange() {
        assertThatThrownBy(() -> base().condition(Condition.RANGE).thresholds(Thresholds.low(5)).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires both 'low' and 'high'");
    }

    @Test
    @DisplayName("Should leave fields absent from the update unchanged")
    void shouldApplyOnlySuppliedFields() {
        AlertRule rule = base().condition(Condition.GREATER_THAN).thresholds(Thresholds.high(85)).build();

        AlertRule updated = rule.withUpdate(RuleUpdate.builder().severity(Severity.INFO).build());

        assertThat(updated.getSeverity()).isEqualTo(Severity.INFO);
        assertThat(updated.getThresholds()).isEqualTo(rule.getThresholds());
        assertThat(updated.getTimeFraction()).isEqualTo(rule.getTimeFraction());
        assertThat(rule.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should return an equal rule for an empty update")
    void shouldIgnoreEmptyUpdate() {
        AlertRule rule = base().condition(Condition.GREATER_THAN).thresholds(Thresholds.high(85)).build();
        RuleUpdate empty = RuleUpdate.builder().build();

        assertThat(empty.isEmpty()).isTrue();
        assertThat(rule.withUpdate(empty)).isEqualTo(rule);
    }

    @Test
    @DisplayName("Should resolve condition and severity codes case-insensitively")
    void shouldResolveCodes() {
        assertThat(Condition.fromCode("GT")).isEqualTo(Condition.GREATER_THAN);
        assertThat(Condition.fromCode(" range ")).isEqualTo(Condition.RANGE);
        assertThat(Severity.fromCode("Warning")).isEqualTo(Severity.WARNING);
        assertThatThrownBy(() -> Condition.fromCode("between"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown condition");
    }

    private static AlertRule.Builder base() {
        return AlertRule.builder()
                .name("rule")
                .metric("cpu_usage")
                .severity(Severity.CRITICAL)
                .timeFraction(0.2);
    }
}
