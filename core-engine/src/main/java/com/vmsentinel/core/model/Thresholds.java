package com.vmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Objects;

/**
 * Lower and upper bounds of an {@link AlertRule}. Either bound may be absent;
 * which ones are required depends on the rule's {@link Condition}.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Thresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Thresholds NONE = new Thresholds(null, null);

    private final Double low;
    private final Double high;

    private Thresholds(Double low, Double high) {
        this.low = low;
        this.high = high;
    }

    public static Thresholds of(Double low, Double high) {
        return low == null && high == null ? NONE : new Thresholds(low, high);
    }

    public static Thresholds low(double low) {
        return new Thresholds(low, null);
    }

    public static Thresholds high(double high) {
        return new Thresholds(null, high);
    }

    public static Thresholds range(double low, double high) {
        return new Thresholds(low, high);
    }

    public static Thresholds none() {
        return NONE;
    }

    /**
     * @return the lower bound, or {@code null} if not set
     */
    public Double getLow() {
        return low;
    }

    /**
     * @return the upper bound, or {@code null} if not set
     */
    public Double getHigh() {
        return high;
    }

    public boolean hasLow() {
        return low != null;
    }

    public boolean hasHigh() {
        return high != null;
    }

    /**
     * Overlay the bounds present in {@code update} on top of this instance.
     * Bounds absent from {@code update} are kept.
     *
     * @param update bounds to apply; must not be {@code null}
     * @return merged thresholds
     */
    public Thresholds mergedWith(Thresholds update) {
        Objects.requireNonNull(update, "update must not be null");
        return of(update.low != null ? update.low : low,
                update.high != null ? update.high : high);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Thresholds that))
            return false;
        return Objects.equals(low, that.low) && Objects.equals(high, that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high);
    }

    @Override
    public String toString() {
        return "Thresholds{low=" + low + ", high=" + high + '}';
    }
}
