package com.vmsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Descriptive statistics of one metric series in a window.
 *
 * @since 1.0.0
 */
public final class MetricSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double max;
    private final double min;
    private final double std;

    public MetricSummary(double mean, double max, double min, double std) {
        this.mean = mean;
        this.max = max;
        this.min = min;
        this.std = std;
    }

    public double getMean() {
        return mean;
    }

    public double getMax() {
        return max;
    }

    public double getMin() {
        return min;
    }

    /**
     * @return sample standard deviation ({@code n - 1} denominator), {@code 0} for a single value
     */
    public double getStd() {
        return std;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSummary that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(std, that.std) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, max, min, std);
    }

    @Override
    public String toString() {
        return "MetricSummary{mean=" + mean + ", max=" + max + ", min=" + min + ", std=" + std + '}';
    }
}
