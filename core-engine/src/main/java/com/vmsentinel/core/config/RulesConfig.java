package com.vmsentinel.core.config;

import com.vmsentinel.core.rules.DefaultRules;
import com.vmsentinel.core.rules.RuleSet;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * overloadMetrics: [cpu_usage, memory_usage, cpu_ready_summation]
 * underloadMetrics: [cpu_usage, memory_usage, network_usage_percent]
 * underloadQuorum: 3
 * rules:
 *   - name: high_cpu_usage
 *     metric: cpu_usage
 *     condition: gt
 *     high: 85
 *     severity: critical
 *     timeFraction: 0.2
 *     description: Average CPU usage &gt; 85%
 * </pre>
 *
 * <p>
 * Omitted metric sets and quorum fall back to the defaults of
 * {@link DefaultRules}. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<RuleDefinition> rules = new ArrayList<>();
    private List<String> overloadMetrics = new ArrayList<>(DefaultRules.OVERLOAD_METRICS);
    private List<String> underloadMetrics = new ArrayList<>(DefaultRules.UNDERLOAD_METRICS);
    private int underloadQuorum = RuleSet.DEFAULT_UNDERLOAD_QUORUM;

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of rule definitions
     */
    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the rule definitions
     */
    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public List<String> getOverloadMetrics() {
        return Collections.unmodifiableList(overloadMetrics);
    }

    public void setOverloadMetrics(List<String> overloadMetrics) {
        this.overloadMetrics = overloadMetrics != null ? new ArrayList<>(overloadMetrics) : new ArrayList<>();
    }

    public List<String> getUnderloadMetrics() {
        return Collections.unmodifiableList(underloadMetrics);
    }

    public void setUnderloadMetrics(List<String> underloadMetrics) {
        this.underloadMetrics = underloadMetrics != null ? new ArrayList<>(underloadMetrics) : new ArrayList<>();
    }

    public int getUnderloadQuorum() {
        return underloadQuorum;
    }

    public void setUnderloadQuorum(int underloadQuorum) {
        this.underloadQuorum = underloadQuorum;
    }

    /**
     * Validate every rule in this configuration.
     *
     * <p>
     * Delegates to {@link RuleDefinition#validate()} for each rule, checks that
     * rule names are unique and that the quorum is positive. Collects all errors
     * and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }
        if (underloadQuorum < 1) {
            errors.add("underloadQuorum must be >= 1, got: " + underloadQuorum);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return a new rule set holding these rules in file order
     * @throws IllegalStateException if the configuration is invalid
     */
    public RuleSet toRuleSet() {
        validate();
        RuleSet.Builder builder = RuleSet.builder()
                .overloadMetrics(overloadMetrics)
                .underloadMetrics(underloadMetrics)
                .underloadQuorum(underloadQuorum);
        rules.forEach(definition -> builder.rule(definition.toAlertRule()));
        return builder.build();
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules
                + ", overloadMetrics=" + overloadMetrics
                + ", underloadMetrics=" + underloadMetrics
                + ", underloadQuorum=" + underloadQuorum + '}';
    }
}
