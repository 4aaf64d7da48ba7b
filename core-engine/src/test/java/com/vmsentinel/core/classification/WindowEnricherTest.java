package com.vmsentinel.core.classification;

import com.vmsentinel.core.config.AnalysisSettings;
import com.vmsentinel.core.model.MetricWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WindowEnricher}.
 */
class WindowEnricherTest {

    private static final List<Instant> AXIS = List.of(
            Instant.parse("2024-05-01T00:00:00Z"),
            Instant.parse("2024-05-01T00:30:00Z"));

    @Test
    @DisplayName("Should derive network usage percent from throughput and default capacity")
    void shouldDeriveNetworkPercent() {
        MetricWindow window = MetricWindow.of(AXIS, Map.of("network_in_mbps", List.of(10.0, 500.0)));

        MetricWindow enriched = new WindowEnricher().enrich(window);

        assertThat(enriched.series("network_usage_percent")).contains(List.of(1.0, 50.0));
        assertThat(enriched.series("network_in_mbps")).contains(List.of(10.0, 500.0));
    }

    @Test
    @DisplayName("Should use the configured capacity and replace an existing percent series")
    void shouldUseConfiguredCapacity() {
        Map<String, List<Double>> series = new LinkedHashMap<>();
        series.put("network_in_mbps", List.of(25.0, 100.0));
        series.put("network_usage_percent", List.of(99.0, 99.0));
        AnalysisSettings settings = AnalysisSettings.builder().networkCapacityMbps(100).build();

        MetricWindow enriched = new WindowEnricher(settings).enrich(MetricWindow.of(AXIS, series));

        assertThat(enriched.series("network_usage_percent")).contains(List.of(25.0, 100.0));
    }

    @Test
    @DisplayName("Should reject null settings")
    void shouldRejectNullSettings() {
        assertThatThrownBy(() -> new WindowEnricher(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("AnalysisSettings must not be null");
    }

    @Test
    @DisplayName("Should leave windows without throughput unchanged")
    void shouldLeaveOtherWindowsUnchanged() {
        MetricWindow window = MetricWindow.of(AXIS, Map.of("cpu_usage", List.of(10.0, 20.0)));

        assertThat(new WindowEnricher().enrich(window)).isSameAs(window);
    }
}
