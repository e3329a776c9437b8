package com.phillippitts.aerodefect.exception;

/**
 * Raised inside ensemble aggregation when a detection carries unusable geometry.
 * The aggregator drops the offending detection and records a warning instead of failing the job.
 */
public class AggregationException extends AeroDefectException {

    public AggregationException(String message) {
        super(message);
    }
}
