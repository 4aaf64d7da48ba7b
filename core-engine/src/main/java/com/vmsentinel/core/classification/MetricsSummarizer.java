package com.vmsentinel.core.classification;

import com.vmsentinel.core.model.MetricNames;
import com.vmsentinel.core.model.MetricSummary;
import com.vmsentinel.core.model.MetricWindow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes mean, max, min and sample standard deviation for the headline
 * metrics of a window.
 *
 * @since 1.0.0
 */
public class MetricsSummarizer {

    /** Metrics summarised by default, in report order. */
    public static final List<String> DEFAULT_METRICS = List.of(
            MetricNames.CPU_USAGE, MetricNames.MEMORY_USAGE, MetricNames.NETWORK_IN_MBPS);

    private final List<String> metrics;

    public MetricsSummarizer() {
        this(DEFAULT_METRICS);
    }

    public MetricsSummarizer(List<String> metrics) {
        this.metrics = List.copyOf(Objects.requireNonNull(metrics, "metrics must not be null"));
    }

    /**
     * @param window window to summarise
     * @return summary per configured metric present in the window; empty for an empty window
     */
    public Map<String, MetricSummary> summarize(MetricWindow window) {
        Map<String, MetricSummary> summary = new LinkedHashMap<>();
        if (window.isEmpty()) {
            return summary;
        }
        for (String metric : metrics) {
            window.series(metric).ifPresent(values -> summary.put(metric, summarize(values)));
        }
        return summary;
    }

    static MetricSummary summarize(List<Double> values) {
        int n = values.size();
        double sum = 0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            sum += v;
            max = Math.max(max, v);
            min = Math.min(min, v);
        }
        double mean = sum / n;

        double std = 0;
        if (n > 1) {
            double sumSquaredDiff = 0;
            for (double v : values) {
                double diff = v - mean;
                sumSquaredDiff += diff * diff;
            }
            std = Math.sqrt(sumSquaredDiff / (n - 1));
        }
        return new MetricSummary(mean, max, min, std);
    }
}
