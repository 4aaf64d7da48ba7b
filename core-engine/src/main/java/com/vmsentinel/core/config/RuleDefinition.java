package com.vmsentinel.core.config;

import com.vmsentinel.core.model.AlertRule;
import com.vmsentinel.core.model.Condition;
import com.vmsentinel.core.model.Severity;
import com.vmsentinel.core.model.Thresholds;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One alert rule as written in the rules YAML.
 *
 * <p>
 * Supported conditions:
 * </p>
 * <ul>
 * <li>{@code gt}: requires {@code high}</li>
 * <li>{@code lt}: requires {@code low}</li>
 * <li>{@code range}: requires both {@code low} and {@code high}</li>
 * </ul>
 *
 * <p>
 * Bounds are typed as {@link Number} so that both {@code 85} and {@code 85.0}
 * are accepted. Call {@link #validate()} after deserialization, then
 * {@link #toAlertRule()}.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private String metric;

    /** Condition code: "gt", "lt" or "range". */
    private String condition;

    private Number low;
    private Number high;

    /** Severity code: "critical", "warning" or "info". */
    private String severity;

    private String description = "";

    private double timeFraction = 0.2;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared condition are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (metric == null || metric.isBlank()) {
            errors.add("Rule '" + name + "' requires 'metric'");
        }
        if (Double.isNaN(timeFraction) || timeFraction < 0 || timeFraction > 1) {
            errors.add("Rule '" + name + "' requires 'timeFraction' in [0, 1], got: " + timeFraction);
        }
        try {
            Severity.fromCode(severity);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + name + "': " + e.getMessage());
        }

        try {
            switch (Condition.fromCode(condition)) {
                case GREATER_THAN -> {
                    if (high == null) {
                        errors.add("gt rule '" + name + "' requires 'high'");
                    }
                }
                case LESS_THAN -> {
                    if (low == null) {
                        errors.add("lt rule '" + name + "' requires 'low'");
                    }
                }
                case RANGE -> {
                    if (low == null || high == null) {
                        errors.add("range rule '" + name + "' requires 'low' and 'high'");
                    } else if (low.doubleValue() > high.doubleValue()) {
                        errors.add("range rule '" + name + "' requires 'low' <= 'high'");
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + name + "': " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid RuleDefinition: " + String.join("; ", errors));
        }
    }

    /**
     * @return the immutable rule described by this definition
     * @throws IllegalStateException    if the definition is invalid
     * @throws IllegalArgumentException if a condition or severity code is unknown
     */
    public AlertRule toAlertRule() {
        return AlertRule.builder()
                .name(name)
                .metric(metric)
                .condition(Condition.fromCode(condition))
                .thresholds(Thresholds.of(
                        low != null ? low.doubleValue() : null,
                        high != null ? high.doubleValue() : null))
                .severity(Severity.fromCode(severity))
                .description(description)
                .timeFraction(timeFraction)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public Number getLow() {
        return low;
    }

    public void setLow(Number low) {
        this.low = low;
    }

    public Number getHigh() {
        return high;
    }

    public void setHigh(Number high) {
        this.high = high;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public double getTimeFraction() {
        return timeFraction;
    }

    public void setTimeFraction(double timeFraction) {
        this.timeFraction = timeFraction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(metric, that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, metric);
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "name='" + name + '\'' +
                ", metric='" + metric + '\'' +
                ", condition='" + condition + '\'' +
                ", low=" + low +
                ", high=" + high +
                ", severity='" + severity + '\'' +
                ", timeFraction=" + timeFraction +
                '}';
    }
}
