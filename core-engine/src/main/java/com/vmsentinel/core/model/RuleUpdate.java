package com.vmsentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Partial update of the mutable fields of an {@link AlertRule}.
 *
 * <p>
 * Only {@code thresholds}, {@code severity} and {@code timeFraction} can change;
 * a rule's name, metric and condition are fixed for its lifetime. Fields left
 * unset are not touched. Threshold bounds are merged individually, so an update
 * carrying only {@code high} keeps the existing {@code low}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleUpdate {

    private final Thresholds thresholds;
    private final Severity severity;
    private final Double timeFraction;

    private RuleUpdate(Builder builder) {
        this.thresholds = builder.thresholds;
        this.severity = builder.severity;
        this.timeFraction = builder.timeFraction;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Thresholds> getThresholds() {
        return Optional.ofNullable(thresholds);
    }

    public Optional<Severity> getSeverity() {
        return Optional.ofNullable(severity);
    }

    public Optional<Double> getTimeFraction() {
        return Optional.ofNullable(timeFraction);
    }

    public boolean isEmpty() {
        return thresholds == null && severity == null && timeFraction == null;
    }

    public static class Builder {
        private Thresholds thresholds;
        private Severity severity;
        private Double timeFraction;

        public Builder thresholds(Thresholds thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
            return this;
        }

        public Builder high(double high) {
            return thresholds(Thresholds.of(thresholds != null ? thresholds.getLow() : null, high));
        }

        public Builder low(double low) {
            return thresholds(Thresholds.of(low, thresholds != null ? thresholds.getHigh() : null));
        }

        public Builder severity(Severity severity) {
            this.severity = Objects.requireNonNull(severity, "severity must not be null");
            return this;
        }

        public Builder timeFraction(double timeFraction) {
            this.timeFraction = timeFraction;
            return this;
        }

        public RuleUpdate build() {
            return new RuleUpdate(this);
        }
    }

    @Override
    public String toString() {
        return "RuleUpdate{" +
                "thresholds=" + thresholds +
                ", severity=" + severity +
                ", timeFraction=" + timeFraction +
                '}';
    }
}
