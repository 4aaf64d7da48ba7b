package com.vmsentinel.core.error;

/**
 * Thrown when the series of a metric window are not aligned index-for-index
 * with its timestamp axis.
 *
 * @since 1.0.0
 */
public class MalformedWindowException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedWindowException(String message) {
        super(message);
    }
}
