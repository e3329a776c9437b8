package com.phillippitts.aerodefect.exception;

/**
 * Thrown when a submission waited longer than the configured queue timeout for an inspection slot.
 */
public class CapacityExceededException extends AeroDefectException {

    public CapacityExceededException(int maxConcurrentJobs, long waitedMs) {
        super("No inspection slot free after " + waitedMs + " ms (limit " + maxConcurrentJobs + " concurrent jobs)");
    }
}
