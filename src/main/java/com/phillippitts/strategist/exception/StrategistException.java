package com.phillippitts.strategist.exception;

/**
 * Base exception for all strategist application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class StrategistException extends RuntimeException {

    public StrategistException(String message) {
        super(message);
    }

    public StrategistException(String message, Throwable cause) {
        super(message, cause);
    }

    public StrategistException(Throwable cause) {
        super(cause);
    }
}
