package com.vmsentinel.core.error;

/**
 * Thrown when an expected sampling interval is not strictly positive, or is
 * too small for the number of points it implies over a range to be counted.
 *
 * @since 1.0.0
 */
public class InvalidIntervalException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidIntervalException(double expectedIntervalMinutes) {
        super("expectedIntervalMinutes must be > 0, got: " + expectedIntervalMinutes);
    }

    public InvalidIntervalException(String message) {
        super(message);
    }
}
