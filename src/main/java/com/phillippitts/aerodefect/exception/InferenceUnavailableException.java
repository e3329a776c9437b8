package com.phillippitts.aerodefect.exception;

/**
 * Thrown when both detectors failed for a job, so no usable result can be formed.
 */
public class InferenceUnavailableException extends AeroDefectException {

    private final String primaryError;
    private final String secondaryError;

    public InferenceUnavailableException(String primaryError, String secondaryError) {
        super("All inference backends unavailable (primary: " + primaryError
                + "; secondary: " + secondaryError + ")");
        this.primaryError = primaryError;
        this.secondaryError = secondaryError;
    }

    public String getPrimaryError() {
        return primaryError;
    }

    public String getSecondaryError() {
        return secondaryError;
    }
}
