package com.phillippitts.aerodefect.service.ensemble;

import com.phillippitts.aerodefect.domain.Detection;

import java.util.List;

/**
 * Aggregator output: the final ranked detections plus any warnings raised while dropping bad input.
 */
public record AggregatedDetections(List<Detection> detections, List<String> warnings) {

    public AggregatedDetections {
        detections = detections == null ? List.of() : List.copyOf(detections);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static AggregatedDetections empty() {
        return new AggregatedDetections(List.of(), List.of());
    }
}
