package com.vmsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of classifying one window: the derived status, the alerts that fired
 * (in rule order) and a statistical summary of the main metrics.
 *
 * @since 1.0.0
 */
public final class StatusReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final ServerStatus status;
    private final List<Alert> alerts;
    private final Map<String, MetricSummary> metricsSummary;

    public StatusReport(String entity, ServerStatus status, List<Alert> alerts,
                        Map<String, MetricSummary> metricsSummary) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.alerts = List.copyOf(alerts);
        this.metricsSummary = Collections.unmodifiableMap(new LinkedHashMap<>(metricsSummary));
    }

    /**
     * @param entity monitored entity name
     * @return the report for a window without samples
     */
    public static StatusReport unknown(String entity) {
        return new StatusReport(entity, ServerStatus.UNKNOWN, List.of(), Map.of());
    }

    public String getEntity() {
        return entity;
    }

    public ServerStatus getStatus() {
        return status;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public Map<String, MetricSummary> getMetricsSummary() {
        return metricsSummary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StatusReport that))
            return false;
        return entity.equals(that.entity)
                && status == that.status
                && alerts.equals(that.alerts)
                && metricsSummary.equals(that.metricsSummary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, status, alerts, metricsSummary);
    }

    @Override
    public String toString() {
        return "StatusReport{" +
                "entity='" + entity + '\'' +
                ", status=" + status +
                ", alerts=" + alerts.size() +
                '}';
    }
}
