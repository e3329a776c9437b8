package com.phillippitts.aerodefect.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One predicted defect instance.
 *
 * @param defectClass class from the fixed allowlist
 * @param confidence  score in [0,1]
 * @param bbox        box in original-image pixel space
 * @param source      detector that produced it, or {@code ENSEMBLE} for a merge
 * @param description free-text note from the remote model; null for everything else
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Detection(
        @JsonProperty("class") DefectClass defectClass,
        double confidence,
        BoundingBox bbox,
        DetectionSource source,
        String description
) {

    public Detection {
        Objects.requireNonNull(defectClass, "defectClass");
        Objects.requireNonNull(bbox, "bbox");
        Objects.requireNonNull(source, "source");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public Detection(DefectClass defectClass, double confidence, BoundingBox bbox, DetectionSource source) {
        this(defectClass, confidence, bbox, source, null);
    }
}
