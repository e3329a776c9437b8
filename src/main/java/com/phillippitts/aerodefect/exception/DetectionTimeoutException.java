package com.phillippitts.aerodefect.exception;

/**
 * Signals that a detector branch did not finish before the job deadline.
 *
 * <p>Soft error: the branch is abandoned and the job proceeds in degraded mode.
 */
public class DetectionTimeoutException extends DetectorUnavailableException {

    private final long deadlineMs;

    public DetectionTimeoutException(String detectorName, long deadlineMs) {
        super("No result within job deadline of " + deadlineMs + " ms", detectorName);
        this.deadlineMs = deadlineMs;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }
}
