package com.phillippitts.aerodefect.service.ensemble;

import com.phillippitts.aerodefect.domain.Detection;

import java.util.List;

/**
 * Strategy for combining the two detectors' outputs into one defect list.
 *
 * <p>Implementations must be stateless and thread-safe; a single instance serves all jobs.
 */
public interface DetectionAggregator {

    /**
     * @param primary   local model detections (empty when that detector failed)
     * @param secondary remote model detections (empty when that detector failed)
     * @return final detections sorted by confidence descending, plus warnings
     */
    AggregatedDetections aggregate(List<Detection> primary, List<Detection> secondary);
}
