package com.vmsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A stretch between two consecutive samples that is longer than the expected
 * sampling interval allows.
 *
 * @since 1.0.0
 */
public final class GapInterval implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant gapStart;
    private final Instant gapEnd;
    private final double gapDurationMinutes;
    private final int missingPointsEstimate;
    private final double expectedIntervalMinutes;

    public GapInterval(Instant gapStart, Instant gapEnd, double gapDurationMinutes,
                       int missingPointsEstimate, double expectedIntervalMinutes) {
        this.gapStart = Objects.requireNonNull(gapStart, "gapStart must not be null");
        this.gapEnd = Objects.requireNonNull(gapEnd, "gapEnd must not be null");
        this.gapDurationMinutes = gapDurationMinutes;
        this.missingPointsEstimate = missingPointsEstimate;
        this.expectedIntervalMinutes = expectedIntervalMinutes;
    }

    /**
     * @return timestamp of the last sample before the gap
     */
    public Instant getGapStart() {
        return gapStart;
    }

    /**
     * @return timestamp of the first sample after the gap
     */
    public Instant getGapEnd() {
        return gapEnd;
    }

    public double getGapDurationMinutes() {
        return gapDurationMinutes;
    }

    public int getMissingPointsEstimate() {
        return missingPointsEstimate;
    }

    public double getExpectedIntervalMinutes() {
        return expectedIntervalMinutes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GapInterval that))
            return false;
        return Double.compare(gapDurationMinutes, that.gapDurationMinutes) == 0
                && missingPointsEstimate == that.missingPointsEstimate
                && Double.compare(expectedIntervalMinutes, that.expectedIntervalMinutes) == 0
                && gapStart.equals(that.gapStart)
                && gapEnd.equals(that.gapEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gapStart, gapEnd, gapDurationMinutes, missingPointsEstimate, expectedIntervalMinutes);
    }

    @Override
    public String toString() {
        return "GapInterval{" +
                "gapStart=" + gapStart +
                ", gapEnd=" + gapEnd +
                ", gapDurationMinutes=" + gapDurationMinutes +
                ", missingPointsEstimate=" + missingPointsEstimate +
                '}';
    }
}
