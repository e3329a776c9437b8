package com.phillippitts.aerodefect.service.ensemble;

import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.exception.AggregationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Template for aggregators: input screening and final ordering live here, the combining rule
 * lives in {@link #doAggregate}.
 *
 * <p>Screening drops null entries and detections whose bounding box is not well formed (non-finite
 * coordinates or no area). Each drop is logged and recorded as a warning; the job continues.
 *
 * <p>The final order is confidence descending, then class declaration order, then x, then y, so the
 * same inputs always produce the same list.
 */
public abstract class AbstractAggregator implements DetectionAggregator {

    private static final Logger LOG = LogManager.getLogger(AbstractAggregator.class);

    static final Comparator<Detection> FINAL_ORDER = Comparator
            .comparingDouble(Detection::confidence).reversed()
            .thenComparing(Detection::defectClass)
            .thenComparingDouble(d -> d.bbox().x())
            .thenComparingDouble(d -> d.bbox().y());

    @Override
    public final AggregatedDetections aggregate(List<Detection> primary, List<Detection> secondary) {
        List<String> warnings = new ArrayList<>();
        List<Detection> cleanPrimary = screen(primary, "primary", warnings);
        List<Detection> cleanSecondary = screen(secondary, "secondary", warnings);

        if (cleanPrimary.isEmpty() && cleanSecondary.isEmpty()) {
            return new AggregatedDetections(List.of(), warnings);
        }

        List<Detection> combined = new ArrayList<>(doAggregate(cleanPrimary, cleanSecondary));
        combined.sort(FINAL_ORDER);
        return new AggregatedDetections(combined, warnings);
    }

    /**
     * Combines two screened detection lists.
     *
     * @param primary   well-formed primary detections (never null, may be empty)
     * @param secondary well-formed secondary detections (never null, may be empty)
     * @return surviving detections in any order
     */
    protected abstract List<Detection> doAggregate(List<Detection> primary, List<Detection> secondary);

    private static List<Detection> screen(List<Detection> input, String label, List<String> warnings) {
        if (input == null || input.isEmpty()) {
            return List.of();
        }
        List<Detection> kept = new ArrayList<>(input.size());
        for (int i = 0; i < input.size(); i++) {
            try {
                kept.add(requireWellFormed(input.get(i), label, i));
            } catch (AggregationException e) {
                LOG.warn("Dropping detection: {}", e.getMessage());
                warnings.add(e.getMessage());
            }
        }
        return kept;
    }

    private static Detection requireWellFormed(Detection d, String label, int index) {
        if (d == null) {
            throw new AggregationException("Dropped null " + label + " detection at index " + index);
        }
        if (!d.bbox().isWellFormed()) {
            throw new AggregationException("Dropped malformed " + label + " detection ("
                    + d.defectClass().wireName() + ") with bbox " + d.bbox());
        }
        return d;
    }
}
