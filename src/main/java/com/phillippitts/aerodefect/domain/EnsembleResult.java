package com.phillippitts.aerodefect.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final, confidence-ranked defect list for one inspection image.
 *
 * <p>An empty {@code detections} list means no defects were found. {@code degraded} is set when
 * only one detector contributed.
 */
public record EnsembleResult(
        @JsonProperty("defects") List<Detection> detections,
        long processingTimeMs,
        boolean degraded,
        List<String> warnings,
        double qualityScore,
        InspectionMetadata metadata
) {

    public EnsembleResult {
        detections = detections == null ? List.of() : List.copyOf(detections);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
