package com.phillippitts.aerodefect.exception;

/**
 * Thrown when a detector backend (local model or remote endpoint) cannot produce a result.
 *
 * <p>Never job-fatal on its own: adapters convert it into a failed
 * {@link com.phillippitts.aerodefect.domain.DetectionSet} and the coordinator decides.
 */
public class DetectorUnavailableException extends AeroDefectException {

    private final String detectorName;

    public DetectorUnavailableException(String message, String detectorName) {
        super(message + " (detector: " + detectorName + ")");
        this.detectorName = detectorName;
    }

    public DetectorUnavailableException(String message, String detectorName, Throwable cause) {
        super(message + " (detector: " + detectorName + ")", cause);
        this.detectorName = detectorName;
    }

    public String getDetectorName() {
        return detectorName;
    }
}
