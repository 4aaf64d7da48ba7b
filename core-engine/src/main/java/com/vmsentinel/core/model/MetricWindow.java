package com.vmsentinel.core.model;

import com.vmsentinel.core.error.MalformedWindowException;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A set of per-metric value series sharing one timestamp axis.
 *
 * <p>
 * Every series holds exactly one value per timestamp; the constructor rejects
 * any other shape with {@link MalformedWindowException}. Series keep their
 * insertion order.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Instant> timestamps;
    private final Map<String, List<Double>> series;

    private MetricWindow(List<Instant> timestamps, Map<String, List<Double>> series) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        Objects.requireNonNull(series, "series must not be null");

        List<String> errors = new ArrayList<>();
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : series.entrySet()) {
            String metric = Objects.requireNonNull(entry.getKey(), "metric name must not be null");
            List<Double> values = List.copyOf(Objects.requireNonNull(entry.getValue(),
                    "series '" + metric + "' must not be null"));
            if (values.size() != timestamps.size()) {
                errors.add("'" + metric + "' has " + values.size() + " value(s)");
            }
            copy.put(metric, values);
        }
        if (!errors.isEmpty()) {
            throw new MalformedWindowException("Window has " + timestamps.size()
                    + " timestamp(s) but " + String.join(", ", errors));
        }

        this.timestamps = List.copyOf(timestamps);
        this.series = Collections.unmodifiableMap(copy);
    }

    /**
     * @param timestamps shared timestamp axis
     * @param series     metric name to values, aligned with {@code timestamps}
     * @return a validated window
     * @throws MalformedWindowException if any series length differs from the axis
     */
    public static MetricWindow of(List<Instant> timestamps, Map<String, List<Double>> series) {
        return new MetricWindow(timestamps, series);
    }

    public static MetricWindow empty() {
        return new MetricWindow(List.of(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return number of samples on the timestamp axis
     */
    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    /**
     * @return the last timestamp of the axis
     * @throws IllegalStateException if the window is empty
     */
    public Instant lastTimestamp() {
        if (timestamps.isEmpty()) {
            throw new IllegalStateException("Empty window has no last timestamp");
        }
        return timestamps.get(timestamps.size() - 1);
    }

    public Set<String> metricNames() {
        return series.keySet();
    }

    public boolean hasMetric(String metric) {
        return series.containsKey(metric);
    }

    public Optional<List<Double>> series(String metric) {
        return Optional.ofNullable(series.get(metric));
    }

    /**
     * Return a new window with {@code values} stored under {@code metric},
     * replacing any existing series of that name.
     *
     * @param metric metric name
     * @param values values aligned with this window's timestamps
     * @return the extended window
     * @throws MalformedWindowException if {@code values} has the wrong length
     */
    public MetricWindow withSeries(String metric, List<Double> values) {
        Map<String, List<Double>> extended = new LinkedHashMap<>(series);
        extended.put(metric, values);
        return new MetricWindow(timestamps, extended);
    }

    /**
     * Assembles a window from a timestamp axis and named series.
     */
    public static class Builder {
        private final List<Instant> timestamps = new ArrayList<>();
        private final Map<String, List<Double>> series = new LinkedHashMap<>();

        public Builder timestamps(List<Instant> timestamps) {
            this.timestamps.clear();
            this.timestamps.addAll(timestamps);
            return this;
        }

        public Builder series(String metric, List<Double> values) {
            series.put(metric, values);
            return this;
        }

        public MetricWindow build() {
            return new MetricWindow(timestamps, series);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricWindow that))
            return false;
        return timestamps.equals(that.timestamps) && series.equals(that.series);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamps, series);
    }

    @Override
    public String toString() {
        return "MetricWindow{size=" + timestamps.size() + ", metrics=" + series.keySet() + '}';
    }
}
