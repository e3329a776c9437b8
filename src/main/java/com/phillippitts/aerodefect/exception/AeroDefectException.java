package com.phillippitts.aerodefect.exception;

/**
 * Base exception for all aero-defect application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AeroDefectException extends RuntimeException {

    public AeroDefectException(String message) {
        super(message);
    }

    public AeroDefectException(String message, Throwable cause) {
        super(message, cause);
    }
}
