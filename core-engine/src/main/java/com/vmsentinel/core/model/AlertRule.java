package com.vmsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named threshold condition over one metric series.
 *
 * <p>
 * A rule fires for a window when at least {@code floor(total * timeFraction)}
 * of the window's values satisfy its {@link Condition}. {@link Condition#RANGE}
 * rules ignore {@code timeFraction} and require every value to be in range.
 * </p>
 *
 * <p>
 * Instances are immutable. A {@code RuleSet} changes a rule by replacing it with
 * the result of {@link #withUpdate(RuleUpdate)}, so an {@link Alert} always
 * refers to the rule exactly as it was evaluated.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String metric;
    private final Condition condition;
    private final Thresholds thresholds;
    private final Severity severity;
    private final String description;
    private final double timeFraction;

    private AlertRule(Builder builder) {
        this.name = builder.name;
        this.metric = builder.metric;
        this.condition = builder.condition;
        this.thresholds = builder.thresholds != null ? builder.thresholds : Thresholds.none();
        this.severity = builder.severity;
        this.description = builder.description != null ? builder.description : "";
        this.timeFraction = builder.timeFraction;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return a copy of this rule with the fields present in {@code update} applied.
     * Thresholds are merged bound by bound.
     *
     * @param update partial update; must not be {@code null}
     * @return the updated rule
     * @throws IllegalStateException if the resulting rule is invalid
     */
    public AlertRule withUpdate(RuleUpdate update) {
        Objects.requireNonNull(update, "RuleUpdate must not be null");
        Builder builder = toBuilder();
        update.getThresholds().ifPresent(t -> builder.thresholds(thresholds.mergedWith(t)));
        update.getSeverity().ifPresent(builder::severity);
        update.getTimeFraction().ifPresent(builder::timeFraction);
        return builder.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .metric(metric)
                .condition(condition)
                .thresholds(thresholds)
                .severity(severity)
                .description(description)
                .timeFraction(timeFraction);
    }

    public String getName() {
        return name;
    }

    /**
     * @return key of the window series this rule reads
     */
    public String getMetric() {
        return metric;
    }

    public Condition getCondition() {
        return condition;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return minimum fraction of window values, in {@code [0, 1]}, that must
     *         satisfy the condition
     */
    public double getTimeFraction() {
        return timeFraction;
    }

    /**
     * Fluent builder for {@link AlertRule}. {@link #build()} validates the rule.
     */
    public static class Builder {
        private String name;
        private String metric;
        private Condition condition;
        private Thresholds thresholds;
        private Severity severity;
        private String description;
        private double timeFraction = 0.2;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder condition(Condition condition) {
            this.condition = condition;
            return this;
        }

        public Builder thresholds(Thresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder timeFraction(double timeFraction) {
            this.timeFraction = timeFraction;
            return this;
        }

        /**
         * Build and validate the rule.
         *
         * @return a new {@link AlertRule}
         * @throws IllegalStateException listing every problem found
         */
        public AlertRule build() {
            List<String> errors = new ArrayList<>();

            if (name == null || name.isBlank()) {
                errors.add("Rule 'name' is required");
            }
            if (metric == null || metric.isBlank()) {
                errors.add("Rule '" + name + "' requires 'metric'");
            }
            if (severity == null) {
                errors.add("Rule '" + name + "' requires 'severity'");
            }
            if (Double.isNaN(timeFraction) || timeFraction < 0 || timeFraction > 1) {
                errors.add("Rule '" + name + "' requires 'timeFraction' in [0, 1], got: " + timeFraction);
            }

            Thresholds t = thresholds != null ? thresholds : Thresholds.none();
            if (condition == null) {
                errors.add("Rule '" + name + "' requires 'condition'");
            } else {
                switch (condition) {
                    case GREATER_THAN -> {
                        if (!t.hasHigh()) {
                            errors.add("'gt' rule '" + name + "' requires a 'high' threshold");
                        }
                    }
                    case LESS_THAN -> {
                        if (!t.hasLow()) {
                            errors.add("'lt' rule '" + name + "' requires a 'low' threshold");
                        }
                    }
                    case RANGE -> {
                        if (!t.hasLow() || !t.hasHigh()) {
                            errors.add("'range' rule '" + name + "' requires both 'low' and 'high' thresholds");
                        } else if (t.getLow() > t.getHigh()) {
                            errors.add("'range' rule '" + name + "' requires 'low' <= 'high'");
                        }
                    }
                }
            }

            if (!errors.isEmpty()) {
                throw new IllegalStateException("Invalid AlertRule: " + String.join("; ", errors));
            }
            return new AlertRule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Double.compare(timeFraction, that.timeFraction) == 0
                && name.equals(that.name)
                && metric.equals(that.metric)
                && condition == that.condition
                && thresholds.equals(that.thresholds)
                && severity == that.severity
                && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, metric, condition, thresholds, severity, description, timeFraction);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "name='" + name + '\'' +
                ", metric='" + metric + '\'' +
                ", condition=" + condition +
                ", thresholds=" + thresholds +
                ", severity=" + severity +
                ", timeFraction=" + timeFraction +
                '}';
    }
}
