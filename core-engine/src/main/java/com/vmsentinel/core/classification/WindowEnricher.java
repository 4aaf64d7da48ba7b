package com.vmsentinel.core.classification;

import com.vmsentinel.core.config.AnalysisSettings;
import com.vmsentinel.core.model.MetricNames;
import com.vmsentinel.core.model.MetricWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Adds derived series to a metric window before classification.
 *
 * <p>
 * When the window has {@value MetricNames#NETWORK_IN_MBPS}, a
 * {@value MetricNames#NETWORK_USAGE_PERCENT} series is computed as
 * {@code network_in_mbps / capacityMbps × 100}, replacing any existing one.
 * Windows without raw network throughput are returned unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowEnricher {

    private static final Logger LOG = LoggerFactory.getLogger(WindowEnricher.class);

    private final double networkCapacityMbps;

    public WindowEnricher() {
        this(AnalysisSettings.defaults());
    }

    public WindowEnricher(AnalysisSettings settings) {
        Objects.requireNonNull(settings, "AnalysisSettings must not be null");
        this.networkCapacityMbps = settings.getNetworkCapacityMbps();
    }

    /**
     * @param window window to enrich
     * @return the window with derived series added
     */
    public MetricWindow enrich(MetricWindow window) {
        Optional<List<Double>> networkIn = window.series(MetricNames.NETWORK_IN_MBPS);
        if (networkIn.isEmpty()) {
            return window;
        }
        List<Double> percent = networkIn.get().stream()
                .map(mbps -> mbps / networkCapacityMbps * 100)
                .toList();
        LOG.trace("Derived {} from {} at {} Mbps capacity",
                MetricNames.NETWORK_USAGE_PERCENT, MetricNames.NETWORK_IN_MBPS, networkCapacityMbps);
        return window.withSeries(MetricNames.NETWORK_USAGE_PERCENT, percent);
    }
}
