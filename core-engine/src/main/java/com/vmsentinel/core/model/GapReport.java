package com.vmsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Completeness of a metric series over a closed time range.
 *
 * @since 1.0.0
 */
public final class GapReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant rangeStart;
    private final Instant rangeEnd;
    private final double expectedIntervalMinutes;
    private final int expectedPoints;
    private final int actualPoints;
    private final double completenessPercentage;
    private final List<GapInterval> missingIntervals;

    public GapReport(Instant rangeStart, Instant rangeEnd, double expectedIntervalMinutes,
                     int expectedPoints, int actualPoints, double completenessPercentage,
                     List<GapInterval> missingIntervals) {
        this.rangeStart = Objects.requireNonNull(rangeStart, "rangeStart must not be null");
        this.rangeEnd = Objects.requireNonNull(rangeEnd, "rangeEnd must not be null");
        this.expectedIntervalMinutes = expectedIntervalMinutes;
        this.expectedPoints = expectedPoints;
        this.actualPoints = actualPoints;
        this.completenessPercentage = completenessPercentage;
        this.missingIntervals = List.copyOf(missingIntervals);
    }

    public Instant getRangeStart() {
        return rangeStart;
    }

    public Instant getRangeEnd() {
        return rangeEnd;
    }

    public double getExpectedIntervalMinutes() {
        return expectedIntervalMinutes;
    }

    public int getExpectedPoints() {
        return expectedPoints;
    }

    public int getActualPoints() {
        return actualPoints;
    }

    /**
     * @return {@code actualPoints / expectedPoints * 100}, rounded to two decimals
     */
    public double getCompletenessPercentage() {
        return completenessPercentage;
    }

    /**
     * Difference between expected and observed counts. Negative when the range
     * holds more samples than the schedule predicts (duplicates or over-sampling).
     *
     * @return {@code expectedPoints - actualPoints}
     */
    public int getMissingPoints() {
        return expectedPoints - actualPoints;
    }

    public List<GapInterval> getMissingIntervals() {
        return missingIntervals;
    }

    public int getMissingIntervalsCount() {
        return missingIntervals.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GapReport that))
            return false;
        return expectedPoints == that.expectedPoints
                && actualPoints == that.actualPoints
                && Double.compare(completenessPercentage, that.completenessPercentage) == 0
                && Double.compare(expectedIntervalMinutes, that.expectedIntervalMinutes) == 0
                && rangeStart.equals(that.rangeStart)
                && rangeEnd.equals(that.rangeEnd)
                && missingIntervals.equals(that.missingIntervals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rangeStart, rangeEnd, expectedIntervalMinutes, expectedPoints,
                actualPoints, completenessPercentage, missingIntervals);
    }

    @Override
    public String toString() {
        return "GapReport{" +
                "expectedPoints=" + expectedPoints +
                ", actualPoints=" + actualPoints +
                ", completenessPercentage=" + completenessPercentage +
                ", missingIntervals=" + missingIntervals.size() +
                '}';
    }
}
