package com.vmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert produced when an {@link AlertRule} fires over a metric window.
 *
 * <p>
 * Serialised as {@code {server, rule, value, threshold, severity, timestamp, message}}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code rule}, {@code timestamp} and {@code entity}
 * are required; omitting any of them throws {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"server", "rule", "value", "threshold", "severity", "timestamp", "message"})
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** The rule as it was when evaluated. */
    private final AlertRule rule;

    /** Mean of the values that satisfied the rule. */
    private final double triggeringValue;

    /** Last timestamp of the evaluated window. */
    private final Instant timestamp;

    private final String entity;
    private final String message;

    private Alert(Builder builder) {
        this.rule = Objects.requireNonNull(builder.rule, "rule must not be null");
        this.triggeringValue = builder.triggeringValue;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.entity = Objects.requireNonNull(builder.entity, "entity must not be null");
        this.message = builder.message != null ? builder.message : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private AlertRule rule;
        private double triggeringValue;
        private Instant timestamp;
        private String entity;
        private String message;

        public Builder rule(AlertRule rule) {
            this.rule = rule;
            return this;
        }

        public Builder triggeringValue(double triggeringValue) {
            this.triggeringValue = triggeringValue;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonIgnore
    public AlertRule getRule() {
        return rule;
    }

    @JsonProperty("rule")
    public String getRuleName() {
        return rule.getName();
    }

    @JsonProperty("value")
    public double getTriggeringValue() {
        return triggeringValue;
    }

    @JsonProperty("threshold")
    public Thresholds getThresholds() {
        return rule.getThresholds();
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return rule.getSeverity();
    }

    @JsonIgnore
    public String getMetric() {
        return rule.getMetric();
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return name of the monitored entity the alert refers to
     */
    @JsonProperty("server")
    public String getEntity() {
        return entity;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Double.compare(triggeringValue, alert.triggeringValue) == 0
                && rule.equals(alert.rule)
                && timestamp.equals(alert.timestamp)
                && entity.equals(alert.entity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rule, triggeringValue, timestamp, entity);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "rule='" + rule.getName() + '\'' +
                ", entity='" + entity + '\'' +
                ", value=" + triggeringValue +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                '}';
    }
}
