package com.vmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall operational status of a monitored entity, derived from the alerts
 * fired over one window.
 *
 * <p>
 * {@link #UNKNOWN} is only ever produced for a window without samples.
 * </p>
 *
 * @since 1.0.0
 */
public enum ServerStatus {

    OVERLOADED("overloaded"),
    UNDERLOADED("underloaded"),
    NORMAL("normal"),
    UNKNOWN("unknown");

    private final String code;

    ServerStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
