package com.phillippitts.aerodefect.presentation.controller;

import com.phillippitts.aerodefect.domain.EnsembleResult;

/**
 * Envelope returned by {@code POST /ml/detect}.
 *
 * @param success always true; failures are rendered by the exception handler
 * @param data    the inspection result
 */
public record DetectionResponse(boolean success, EnsembleResult data) {

    public static DetectionResponse of(EnsembleResult result) {
        return new DetectionResponse(true, result);
    }
}
