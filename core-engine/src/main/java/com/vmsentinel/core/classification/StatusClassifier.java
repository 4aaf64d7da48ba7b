package com.vmsentinel.core.classification;

import com.vmsentinel.core.error.MalformedWindowException;
import com.vmsentinel.core.model.Alert;
import com.vmsentinel.core.model.AlertRule;
import com.vmsentinel.core.model.MetricWindow;
import com.vmsentinel.core.model.ServerStatus;
import com.vmsentinel.core.model.Severity;
import com.vmsentinel.core.model.StatusReport;
import com.vmsentinel.core.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a {@link RuleSet} over one metric window and derives the entity's
 * {@link ServerStatus}.
 *
 * <h3>Evaluation</h3>
 * <p>
 * Rules are taken from a snapshot of {@link RuleSet#rules()} and evaluated in
 * that order; alerts keep the same order. A rule whose metric is absent from
 * the window is skipped. Every fired alert carries the window's last timestamp.
 * </p>
 *
 * <h3>Status</h3>
 * <ol>
 * <li>Empty window: {@link ServerStatus#UNKNOWN}, no alerts.</li>
 * <li>Any critical alert on an overload metric: {@link ServerStatus#OVERLOADED}.</li>
 * <li>At least {@link RuleSet#underloadQuorum()} warning alerts on underload
 * metrics: {@link ServerStatus#UNDERLOADED}.</li>
 * <li>Otherwise {@link ServerStatus#NORMAL}.</li>
 * </ol>
 * <p>
 * The status depends only on the current call; there is no hysteresis.
 * </p>
 *
 * <p>
 * This class is <strong>stateless</strong> and may be shared across threads.
 * </p>
 *
 * @since 1.0.0
 */
public class StatusClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(StatusClassifier.class);

    private final MetricsSummarizer summarizer;

    public StatusClassifier() {
        this(new MetricsSummarizer());
    }

    public StatusClassifier(MetricsSummarizer summarizer) {
        this.summarizer = Objects.requireNonNull(summarizer, "MetricsSummarizer must not be null");
    }

    /**
     * Build a window from raw series and evaluate it.
     *
     * @param timestamps shared timestamp axis
     * @param series     metric name to values aligned with {@code timestamps}
     * @param entity     monitored entity name
     * @param rules      rules to apply
     * @return status, alerts and metric summary
     * @throws MalformedWindowException if the series are not aligned with the axis
     */
    public StatusReport evaluate(List<Instant> timestamps, Map<String, List<Double>> series,
                                 String entity, RuleSet rules) {
        return evaluate(MetricWindow.of(timestamps, series), entity, rules);
    }

    /**
     * Evaluate every rule against the window and derive the status.
     *
     * @param window aligned metric window; must not be {@code null}
     * @param entity monitored entity name; must not be {@code null}
     * @param rules  rules to apply; must not be {@code null}
     * @return status, alerts and metric summary
     */
    public StatusReport evaluate(MetricWindow window, String entity, RuleSet rules) {
        Objects.requireNonNull(window, "MetricWindow must not be null");
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(rules, "RuleSet must not be null");

        if (window.isEmpty()) {
            LOG.debug("Empty window for {} - status unknown", entity);
            return StatusReport.unknown(entity);
        }

        Instant asOf = window.lastTimestamp();
        List<Alert> alerts = new ArrayList<>();

        for (AlertRule rule : rules.rules()) {
            Optional<List<Double>> values = window.series(rule.getMetric());
            if (values.isEmpty()) {
                LOG.trace("Rule [{}]: metric '{}' not in window - skipping", rule.getName(), rule.getMetric());
                continue;
            }
            RuleEvaluators.forCondition(rule.getCondition())
                    .evaluate(rule, values.get(), entity, asOf)
                    .ifPresent(alerts::add);
        }

        ServerStatus status = deriveStatus(alerts, rules);
        LOG.debug("Entity {} classified as {} with {} alert(s) over {} sample(s)",
                entity, status, alerts.size(), window.size());

        return new StatusReport(entity, status, alerts, summarizer.summarize(window));
    }

    /**
     * Derive the status from a complete set of fired alerts.
     *
     * @param alerts fired alerts
     * @param rules  rule set supplying the overload/underload metadata
     * @return {@link ServerStatus#OVERLOADED}, {@link ServerStatus#UNDERLOADED}
     *         or {@link ServerStatus#NORMAL}
     */
    ServerStatus deriveStatus(List<Alert> alerts, RuleSet rules) {
        boolean overloaded = alerts.stream()
                .anyMatch(a -> a.getSeverity() == Severity.CRITICAL
                        && rules.overloadMetrics().contains(a.getMetric()));
        if (overloaded) {
            return ServerStatus.OVERLOADED;
        }

        long underloadSignals = alerts.stream()
                .filter(a -> a.getSeverity() == Severity.WARNING
                        && rules.underloadMetrics().contains(a.getMetric()))
                .count();
        if (underloadSignals >= rules.underloadQuorum()) {
            return ServerStatus.UNDERLOADED;
        }

        return ServerStatus.NORMAL;
    }
}
