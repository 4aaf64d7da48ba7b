package com.vmsentinel.core.config;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable defaults for gap analysis and window enrichment.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults:
 * </p>
 * <ul>
 * <li>{@code EXPECTED_INTERVAL_MINUTES}: sampling interval, default {@code 30}</li>
 * <li>{@code GAP_TOLERANCE_FACTOR}: multiple of the interval tolerated before a
 * gap is reported, default {@code 1.5}</li>
 * <li>{@code NETWORK_CAPACITY_MBPS}: link capacity used to derive
 * {@code network_usage_percent}, default {@code 1000}</li>
 * <li>{@code ALERT_HISTORY_CAPACITY}: alerts retained by an alert history,
 * default {@code 100}</li>
 * <li>{@code RULES_CONFIG_PATH}: rules YAML file, default empty (classpath)</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in applications, {@link #defaults()} or the
 * {@link Builder} elsewhere. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_EXPECTED_INTERVAL_MINUTES = 30.0;
    public static final double DEFAULT_TOLERANCE_FACTOR = 1.5;
    public static final double DEFAULT_NETWORK_CAPACITY_MBPS = 1000.0;
    public static final int DEFAULT_ALERT_HISTORY_CAPACITY = 100;

    private final double expectedIntervalMinutes;
    private final double toleranceFactor;
    private final double networkCapacityMbps;
    private final int alertHistoryCapacity;
    private final String rulesConfigPath;

    private AnalysisSettings(Builder b) {
        this.expectedIntervalMinutes = b.expectedIntervalMinutes;
        this.toleranceFactor = b.toleranceFactor;
        this.networkCapacityMbps = b.networkCapacityMbps;
        this.alertHistoryCapacity = b.alertHistoryCapacity;
        this.rulesConfigPath = b.rulesConfigPath;
    }

    public static AnalysisSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build settings from the process environment.
     *
     * @return fully populated settings
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static AnalysisSettings fromEnvironment() {
        return fromVariables(System.getenv());
    }

    /**
     * Build settings from an explicit variable map, using the same names and
     * defaults as {@link #fromEnvironment()}.
     *
     * @param variables variable name to value; must not be {@code null}
     * @return fully populated settings
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static AnalysisSettings fromVariables(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables must not be null");
        try {
            return builder()
                    .expectedIntervalMinutes(Double.parseDouble(
                            value(variables, "EXPECTED_INTERVAL_MINUTES", "30")))
                    .toleranceFactor(Double.parseDouble(
                            value(variables, "GAP_TOLERANCE_FACTOR", "1.5")))
                    .networkCapacityMbps(Double.parseDouble(
                            value(variables, "NETWORK_CAPACITY_MBPS", "1000")))
                    .alertHistoryCapacity(Integer.parseInt(
                            value(variables, "ALERT_HISTORY_CAPACITY", "100")))
                    .rulesConfigPath(value(variables, RulesLoader.ENV_RULES_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double getExpectedIntervalMinutes() {
        return expectedIntervalMinutes;
    }

    public double getToleranceFactor() {
        return toleranceFactor;
    }

    public double getNetworkCapacityMbps() {
        return networkCapacityMbps;
    }

    public int getAlertHistoryCapacity() {
        return alertHistoryCapacity;
    }

    /**
     * @return configured rules file, or an empty string to use the classpath catalogue
     */
    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnalysisSettings}.
     *
     * <p>
     * {@link #build()} requires a positive interval, tolerance and capacity and
     * an alert history capacity of at least one.
     * </p>
     */
    public static class Builder {
        private double expectedIntervalMinutes = DEFAULT_EXPECTED_INTERVAL_MINUTES;
        private double toleranceFactor = DEFAULT_TOLERANCE_FACTOR;
        private double networkCapacityMbps = DEFAULT_NETWORK_CAPACITY_MBPS;
        private int alertHistoryCapacity = DEFAULT_ALERT_HISTORY_CAPACITY;
        private String rulesConfigPath = "";

        public Builder expectedIntervalMinutes(double v) {
            this.expectedIntervalMinutes = v;
            return this;
        }

        public Builder toleranceFactor(double v) {
            this.toleranceFactor = v;
            return this;
        }

        public Builder networkCapacityMbps(double v) {
            this.networkCapacityMbps = v;
            return this;
        }

        public Builder alertHistoryCapacity(int v) {
            this.alertHistoryCapacity = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        /**
         * @return validated settings
         * @throws IllegalArgumentException if any value is invalid
         */
        public AnalysisSettings build() {
            requirePositive(expectedIntervalMinutes, "expectedIntervalMinutes");
            requirePositive(toleranceFactor, "toleranceFactor");
            requirePositive(networkCapacityMbps, "networkCapacityMbps");
            if (alertHistoryCapacity < 1) {
                throw new IllegalArgumentException(
                        "alertHistoryCapacity must be >= 1, got: " + alertHistoryCapacity);
            }
            Objects.requireNonNull(rulesConfigPath, "rulesConfigPath must not be null");
            return new AnalysisSettings(this);
        }

        private static void requirePositive(double value, String name) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> variables, String name, String defaultValue) {
        String value = variables.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "AnalysisSettings{" +
                "expectedIntervalMinutes=" + expectedIntervalMinutes +
                ", toleranceFactor=" + toleranceFactor +
                ", networkCapacityMbps=" + networkCapacityMbps +
                ", alertHistoryCapacity=" + alertHistoryCapacity +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                '}';
    }
}
