package com.vmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Comparison applied by an {@link AlertRule} to every value of its metric series.
 *
 * @since 1.0.0
 */
public enum Condition {

    /** Value strictly above {@code thresholds.high}. */
    GREATER_THAN("gt"),

    /** Value strictly below {@code thresholds.low}. */
    LESS_THAN("lt"),

    /** Value inside {@code [thresholds.low, thresholds.high]}, both ends inclusive. */
    RANGE("range");

    private final String code;

    Condition(String code) {
        this.code = code;
    }

    /**
     * @return short configuration code ({@code gt}, {@code lt} or {@code range})
     */
    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolve a configuration code, case-insensitively.
     *
     * @param code the code used in rule configuration
     * @return the matching condition
     * @throws IllegalArgumentException if the code is unknown or {@code null}
     */
    public static Condition fromCode(String code) {
        if (code != null) {
            String normalised = code.trim().toLowerCase(Locale.ROOT);
            for (Condition condition : values()) {
                if (condition.code.equals(normalised)) {
                    return condition;
                }
            }
        }
        throw new IllegalArgumentException("Unknown condition: '" + code
                + "'. Supported: gt, lt, range");
    }
}
