package com.phillippitts.aerodefect.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Weights and thresholds for ensemble aggregation. Bound once at startup and shared read-only.
 *
 * <p>Example application.properties:
 * <pre>
 * ensemble.primary-weight=0.6
 * ensemble.secondary-weight=0.4
 * ensemble.match-iou-threshold=0.5
 * ensemble.nms-iou-threshold=0.4
 * ensemble.single-detector-min-confidence=0.7
 * ensemble.min-final-confidence=0.5
 * </pre>
 *
 * <p>Construction fails with {@link IllegalArgumentException} when the weights do not sum to 1.0
 * (within {@link #WEIGHT_SUM_TOLERANCE}) or any threshold lies outside [0,1]. Weights are never
 * renormalized, so a misconfigured deployment refuses to start.
 *
 * @param primaryWeight               vote weight of the local model
 * @param secondaryWeight             vote weight of the remote model
 * @param matchIouThreshold           minimum IoU for two detections to count as the same defect
 * @param nmsIouThreshold             IoU at or above which the weaker same-class box is suppressed
 * @param singleDetectorMinConfidence an uncorroborated detection survives only above this
 * @param minFinalConfidence          detections below this are dropped at the end
 */
@ConfigurationProperties(prefix = "ensemble")
public record EnsembleConfig(
        @DefaultValue("0.6") double primaryWeight,
        @DefaultValue("0.4") double secondaryWeight,
        @DefaultValue("0.5") double matchIouThreshold,
        @DefaultValue("0.4") double nmsIouThreshold,
        @DefaultValue("0.7") double singleDetectorMinConfidence,
        @DefaultValue("0.5") double minFinalConfidence
) {

    public static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    public EnsembleConfig {
        requireUnit("primary-weight", primaryWeight);
        requireUnit("secondary-weight", secondaryWeight);
        if (Math.abs(primaryWeight + secondaryWeight - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new IllegalArgumentException("ensemble weights must sum to 1.0, got primary="
                    + primaryWeight + " secondary=" + secondaryWeight);
        }
        requireUnit("match-iou-threshold", matchIouThreshold);
        requireUnit("nms-iou-threshold", nmsIouThreshold);
        requireUnit("single-detector-min-confidence", singleDetectorMinConfidence);
        requireUnit("min-final-confidence", minFinalConfidence);
    }

    public static EnsembleConfig defaults() {
        return new EnsembleConfig(0.6, 0.4, 0.5, 0.4, 0.7, 0.5);
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException("ensemble." + name + " must be in [0,1], got " + value);
        }
    }
}
