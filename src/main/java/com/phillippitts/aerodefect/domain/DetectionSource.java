package com.phillippitts.aerodefect.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which detector produced a detection. {@link #ENSEMBLE} marks a merge of agreeing detections.
 */
public enum DetectionSource {
    PRIMARY,
    SECONDARY,
    ENSEMBLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
