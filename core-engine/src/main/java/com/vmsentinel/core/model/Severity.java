package com.vmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity attached to an {@link AlertRule} and carried by every {@link Alert} it fires.
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL("critical"),
    WARNING("warning"),
    INFO("info");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolve a configuration code, case-insensitively.
     *
     * @param code severity code
     * @return the matching severity
     * @throws IllegalArgumentException if the code is unknown or {@code null}
     */
    public static Severity fromCode(String code) {
        if (code != null) {
            String normalised = code.trim().toLowerCase(Locale.ROOT);
            for (Severity severity : values()) {
                if (severity.code.equals(normalised)) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + code
                + "'. Supported: critical, warning, info");
    }
}
