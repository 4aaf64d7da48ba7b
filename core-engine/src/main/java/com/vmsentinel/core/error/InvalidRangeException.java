package com.vmsentinel.core.error;

import java.time.Instant;

/**
 * Thrown when a time range ends before it starts.
 *
 * @since 1.0.0
 */
public class InvalidRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidRangeException(Instant rangeStart, Instant rangeEnd) {
        super("Range end " + rangeEnd + " is before range start " + rangeStart);
    }
}
