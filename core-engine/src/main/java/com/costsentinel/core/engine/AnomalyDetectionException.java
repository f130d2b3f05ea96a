package com.costsentinel.core.engine;

/**
 * Raised when a detector fails unexpectedly during a detection run.
 *
 * @since 1.0.0
 */
public class AnomalyDetectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
