package com.vmsentinel.core.rules;

import com.vmsentinel.core.model.AlertRule;
import com.vmsentinel.core.model.Condition;
import com.vmsentinel.core.model.Severity;
import com.vmsentinel.core.model.Thresholds;

import java.util.List;
import java.util.Set;

import static com.vmsentinel.core.model.MetricNames.CPU_READY_SUMMATION;
import static com.vmsentinel.core.model.MetricNames.CPU_USAGE;
import static com.vmsentinel.core.model.MetricNames.DISK_LATENCY;
import static com.vmsentinel.core.model.MetricNames.MEMORY_USAGE;
import static com.vmsentinel.core.model.MetricNames.NETWORK_USAGE_PERCENT;

/**
 * The canonical rule catalogue.
 *
 * <p>
 * Rule names are consumed downstream as alert identifiers and must not change.
 * The same catalogue ships as the classpath resource {@code rules.yml}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefaultRules {

    /** Metrics whose critical alerts mean the entity is overloaded. */
    public static final Set<String> OVERLOAD_METRICS =
            Set.of(CPU_USAGE, MEMORY_USAGE, CPU_READY_SUMMATION);

    /** Metrics whose warning alerts, all together, mean the entity is underloaded. */
    public static final Set<String> UNDERLOAD_METRICS =
            Set.of(CPU_USAGE, MEMORY_USAGE, NETWORK_USAGE_PERCENT);

    private DefaultRules() {
        // utility class
    }

    /**
     * @return a fresh, independently mutable rule set holding the default catalogue
     */
    public static RuleSet ruleSet() {
        return RuleSet.builder()
                .rules(rules())
                .overloadMetrics(OVERLOAD_METRICS)
                .underloadMetrics(UNDERLOAD_METRICS)
                .underloadQuorum(RuleSet.DEFAULT_UNDERLOAD_QUORUM)
                .build();
    }

    /**
     * @return the default rules in declaration order
     */
    public static List<AlertRule> rules() {
        return List.of(
                // Overload
                rule("high_cpu_usage", CPU_USAGE, Condition.GREATER_THAN, Thresholds.high(85),
                        Severity.CRITICAL, "Average CPU usage > 85%", 0.2),
                rule("high_memory_usage", MEMORY_USAGE, Condition.GREATER_THAN, Thresholds.high(80),
                        Severity.CRITICAL, "Average memory usage > 80%", 0.2),
                rule("cpu_ready_time", CPU_READY_SUMMATION, Condition.GREATER_THAN, Thresholds.high(10),
                        Severity.CRITICAL, "CPU ready time > 10% (top 20% peak intervals)", 0.2),

                // Underload
                rule("low_cpu_usage", CPU_USAGE, Condition.LESS_THAN, Thresholds.low(15),
                        Severity.WARNING, "Average CPU usage < 15%", 0.8),
                rule("low_memory_usage", MEMORY_USAGE, Condition.LESS_THAN, Thresholds.low(25),
                        Severity.WARNING, "Average memory usage < 25%", 0.8),
                rule("low_network_usage", NETWORK_USAGE_PERCENT, Condition.LESS_THAN, Thresholds.low(5),
                        Severity.WARNING, "Average network usage < 5% of capacity", 0.8),

                // Normal operation
                rule("normal_cpu_range", CPU_USAGE, Condition.RANGE, Thresholds.range(15, 85),
                        Severity.INFO, "Normal CPU range: 15-85%", 1.0),
                rule("normal_memory_range", MEMORY_USAGE, Condition.RANGE, Thresholds.range(25, 85),
                        Severity.INFO, "Normal memory range: 25-85%", 1.0),
                rule("normal_network_range", NETWORK_USAGE_PERCENT, Condition.RANGE, Thresholds.range(6, 85),
                        Severity.INFO, "Normal network range: 6-85%", 1.0),

                rule("high_disk_latency", DISK_LATENCY, Condition.GREATER_THAN, Thresholds.high(25),
                        Severity.CRITICAL, "High disk latency > 25ms", 0.2));
    }

    private static AlertRule rule(String name, String metric, Condition condition, Thresholds thresholds,
                                  Severity severity, String description, double timeFraction) {
        return AlertRule.builder()
                .name(name)
                .metric(metric)
                .condition(condition)
                .thresholds(thresholds)
                .severity(severity)
                .description(description)
                .timeFraction(timeFraction)
                .build();
    }
}
