package com.phillippitts.aerodefect.domain;

/**
 * Bookkeeping attached to an {@link EnsembleResult}.
 *
 * @param inspectionId        caller-supplied correlation id (may be null)
 * @param jobId               id of the inspection job that produced the result
 * @param primaryDetections   raw detection count from the local model
 * @param secondaryDetections raw detection count from the remote model
 * @param finalDetections     detections surviving aggregation
 * @param originalDimensions  decoded image size
 */
public record InspectionMetadata(
        String inspectionId,
        String jobId,
        int primaryDetections,
        int secondaryDetections,
        int finalDetections,
        Dimensions originalDimensions
) {

    public record Dimensions(int width, int height) {}
}
