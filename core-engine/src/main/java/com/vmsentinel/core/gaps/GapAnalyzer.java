package com.vmsentinel.core.gaps;

import com.vmsentinel.core.config.AnalysisSettings;
import com.vmsentinel.core.error.InvalidIntervalException;
import com.vmsentinel.core.error.InvalidRangeException;
import com.vmsentinel.core.model.GapInterval;
import com.vmsentinel.core.model.GapReport;
import com.vmsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds sampling gaps in a metric series and measures its completeness.
 *
 * <p>
 * A gap is reported between two consecutive samples when the time between
 * them is strictly greater than {@code expectedInterval × toleranceFactor}.
 * Input samples are sorted by timestamp before analysis, so callers need not
 * guarantee ordering.
 * </p>
 *
 * <p>
 * This class is <strong>stateless</strong> and thread-safe; defaults for the
 * interval and tolerance come from {@link AnalysisSettings}.
 * </p>
 *
 * @since 1.0.0
 */
public class GapAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(GapAnalyzer.class);

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final double defaultIntervalMinutes;
    private final double defaultToleranceFactor;

    /** Analyzer using a 30 minute interval and a 1.5 tolerance factor. */
    public GapAnalyzer() {
        this(AnalysisSettings.defaults());
    }

    /**
     * @param settings source of the default interval and tolerance; must not be {@code null}
     */
    public GapAnalyzer(AnalysisSettings settings) {
        Objects.requireNonNull(settings, "AnalysisSettings must not be null");
        this.defaultIntervalMinutes = settings.getExpectedIntervalMinutes();
        this.defaultToleranceFactor = settings.getToleranceFactor();
    }

    // ---------------------------------------------------------------
    // Gap detection
    // ---------------------------------------------------------------

    /**
     * Detect gaps using the configured interval and tolerance.
     *
     * @param samples samples of one metric
     * @return gaps in chronological order
     */
    public List<GapInterval> detectGaps(List<Sample> samples) {
        return detectGaps(samples, defaultIntervalMinutes, defaultToleranceFactor);
    }

    /**
     * Detect gaps using the configured tolerance.
     *
     * @param samples                 samples of one metric
     * @param expectedIntervalMinutes expected time between samples
     * @return gaps in chronological order
     * @throws InvalidIntervalException if {@code expectedIntervalMinutes <= 0}
     */
    public List<GapInterval> detectGaps(List<Sample> samples, double expectedIntervalMinutes) {
        return detectGaps(samples, expectedIntervalMinutes, defaultToleranceFactor);
    }

    /**
     * Walk consecutive sample pairs and report every pair further apart than
     * {@code expectedIntervalMinutes × toleranceFactor}. Fewer than two samples
     * never contain a gap.
     *
     * @param samples                 samples of one metric; must not be {@code null}
     * @param expectedIntervalMinutes expected time between samples
     * @param toleranceFactor         tolerated multiple of the interval
     * @return gaps in chronological order, possibly empty
     * @throws InvalidIntervalException if {@code expectedIntervalMinutes <= 0}
     * @throws IllegalArgumentException if {@code toleranceFactor <= 0}
     */
    public List<GapInterval> detectGaps(List<Sample> samples, double expectedIntervalMinutes,
                                        double toleranceFactor) {
        Objects.requireNonNull(samples, "samples must not be null");
        requireValidInterval(expectedIntervalMinutes);
        if (!(toleranceFactor > 0)) {
            throw new IllegalArgumentException("toleranceFactor must be > 0, got: " + toleranceFactor);
        }
        if (samples.size() < 2) {
            return List.of();
        }

        List<Sample> ordered = sorted(samples);
        double maxIntervalMinutes = expectedIntervalMinutes * toleranceFactor;
        List<GapInterval> gaps = new ArrayList<>();

        for (int i = 0; i < ordered.size() - 1; i++) {
            Instant current = ordered.get(i).getTimestamp();
            Instant next = ordered.get(i + 1).getTimestamp();
            double actualMinutes = Duration.between(current, next).toMillis() / MILLIS_PER_MINUTE;

            if (actualMinutes > maxIntervalMinutes) {
                int missing = (int) Math.max(0, Math.floor(actualMinutes / expectedIntervalMinutes) - 1);
                LOG.debug("Gap {} -> {}: {} min (expected {} min, ~{} point(s) missing)",
                        current, next, actualMinutes, expectedIntervalMinutes, missing);
                gaps.add(new GapInterval(current, next, actualMinutes, missing, expectedIntervalMinutes));
            }
        }
        return Collections.unmodifiableList(gaps);
    }

    // ---------------------------------------------------------------
    // Completeness
    // ---------------------------------------------------------------

    /**
     * Compute completeness over {@code [rangeStart, rangeEnd]} using the configured interval.
     *
     * @see #computeCompleteness(List, Instant, Instant, double)
     */
    public GapReport computeCompleteness(List<Sample> samples, Instant rangeStart, Instant rangeEnd) {
        return computeCompleteness(samples, rangeStart, rangeEnd, defaultIntervalMinutes);
    }

    /**
     * Compare the samples inside {@code [rangeStart, rangeEnd]} (both ends
     * inclusive) with the number a perfect schedule would produce, and list the
     * gaps among them.
     *
     * <p>
     * {@code expectedPoints = floor(rangeMinutes / interval) + 1}, so a range
     * of zero length expects one point.
     * </p>
     *
     * @param samples                 samples of one metric; out-of-range samples are ignored
     * @param rangeStart              inclusive start
     * @param rangeEnd                inclusive end
     * @param expectedIntervalMinutes expected time between samples
     * @return the completeness report
     * @throws InvalidRangeException    if {@code rangeEnd} is before {@code rangeStart}
     * @throws InvalidIntervalException if {@code expectedIntervalMinutes <= 0}, or so small
     *                                  that the expected point count does not fit an {@code int}
     */
    public GapReport computeCompleteness(List<Sample> samples, Instant rangeStart, Instant rangeEnd,
                                         double expectedIntervalMinutes) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(rangeStart, "rangeStart must not be null");
        Objects.requireNonNull(rangeEnd, "rangeEnd must not be null");
        if (rangeEnd.isBefore(rangeStart)) {
            throw new InvalidRangeException(rangeStart, rangeEnd);
        }
        requireValidInterval(expectedIntervalMinutes);

        double rangeMinutes = Duration.between(rangeStart, rangeEnd).toMillis() / MILLIS_PER_MINUTE;
        double slots = Math.floor(rangeMinutes / expectedIntervalMinutes);
        if (slots >= Integer.MAX_VALUE) {
            throw new InvalidIntervalException("expectedIntervalMinutes " + expectedIntervalMinutes
                    + " implies more than " + Integer.MAX_VALUE + " points over " + rangeMinutes + " min");
        }
        int expectedPoints = (int) slots + 1;

        List<Sample> inRange = samples.stream()
                .filter(s -> !s.getTimestamp().isBefore(rangeStart) && !s.getTimestamp().isAfter(rangeEnd))
                .toList();
        int actualPoints = inRange.size();

        double completeness = expectedPoints > 0
                ? round2((double) actualPoints / expectedPoints * 100)
                : 0.0;

        List<GapInterval> gaps = detectGaps(inRange, expectedIntervalMinutes, defaultToleranceFactor);

        LOG.debug("Completeness {} -> {}: {}/{} point(s) = {}%, {} gap(s)",
                rangeStart, rangeEnd, actualPoints, expectedPoints, completeness, gaps.size());

        return new GapReport(rangeStart, rangeEnd, expectedIntervalMinutes,
                expectedPoints, actualPoints, completeness, gaps);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void requireValidInterval(double expectedIntervalMinutes) {
        if (!(expectedIntervalMinutes > 0)) {
            throw new InvalidIntervalException(expectedIntervalMinutes);
        }
    }

    private static List<Sample> sorted(List<Sample> samples) {
        return samples.stream()
                .sorted(Comparator.comparing(Sample::getTimestamp))
                .toList();
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
