package com.phillippitts.aerodefect.domain;

import java.util.List;

/**
 * Output of one detector for one job. Either a (possibly empty) list of detections or an error.
 *
 * @param detections detections sorted by confidence descending; empty when failed
 * @param latencyMs  wall time spent in the detector
 * @param error      failure description, null on success
 */
public record DetectionSet(List<Detection> detections, long latencyMs, String error) {

    public DetectionSet {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }

    public static DetectionSet success(List<Detection> detections, long latencyMs) {
        return new DetectionSet(detections, latencyMs, null);
    }

    public static DetectionSet failure(String error, long latencyMs) {
        return new DetectionSet(List.of(), latencyMs, error == null ? "unknown error" : error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public int size() {
        return detections.size();
    }
}
