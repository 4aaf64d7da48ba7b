package com.vmsentinel.core.history;

import com.vmsentinel.core.config.AnalysisSettings;
import com.vmsentinel.core.model.Alert;
import com.vmsentinel.core.model.AlertRule;
import com.vmsentinel.core.rules.DefaultRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertHistory}.
 */
class AlertHistoryTest {

    private static final AlertRule RULE = DefaultRules.rules().get(0);
    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    private AlertHistory history;

    @BeforeEach
    void setUp() {
        history = new AlertHistory(3);
    }

    @Test
    @DisplayName("Should return recorded alerts oldest first")
    void shouldKeepArrivalOrder() {
        history.record(alerts(0, 2));

        assertThat(history.recent()).extracting(Alert::getEntity).containsExactly("vm-0", "vm-1");
        assertThat(history.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should evict the oldest alerts beyond capacity")
    void shouldEvictOldest() {
        history.record(alerts(0, 2));
        history.record(alerts(2, 3));

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.recent()).extracting(Alert::getEntity).containsExactly("vm-2", "vm-3", "vm-4");
    }

    @Test
    @DisplayName("Should limit recent() to the newest alerts")
    void shouldLimitRecent() {
        history.record(alerts(0, 3));

        assertThat(history.recent(2)).extracting(Alert::getEntity).containsExactly("vm-1", "vm-2");
        assertThat(history.recent(0)).isEmpty();
        assertThat(history.recent(10)).hasSize(3);
        assertThatThrownBy(() -> history.recent(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should clear all alerts")
    void shouldClear() {
        history.record(alerts(0, 3));
        history.clear();

        assertThat(history.recent()).isEmpty();
    }

    @Test
    @DisplayName("Should size itself from settings and reject a zero capacity")
    void shouldValidateCapacity() {
        assertThat(new AlertHistory().capacity()).isEqualTo(100);
        assertThat(new AlertHistory(AnalysisSettings.builder().alertHistoryCapacity(7).build()).capacity())
                .isEqualTo(7);
        assertThatThrownBy(() -> new AlertHistory(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static List<Alert> alerts(int from, int count) {
        List<Alert> alerts = new ArrayList<>();
        for (int i = from; i < from + count; i++) {
            alerts.add(Alert.builder()
                    .rule(RULE)
                    .triggeringValue(90)
                    .timestamp(START.plusSeconds(60L * i))
                    .entity("vm-" + i)
                    .message("alert " + i)
                    .build());
        }
        return alerts;
    }
}
