package com.phillippitts.aerodefect.service.ensemble;

import com.phillippitts.aerodefect.domain.DefectClass;
import com.phillippitts.aerodefect.domain.Detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Class-scoped non-maximum suppression.
 *
 * <p>Within each class, detections are visited in descending confidence order; a detection is
 * suppressed when its IoU with an already kept box is at or above the threshold. Boxes of different
 * classes never suppress each other.
 */
public final class NonMaxSuppression {

    /** Confidence descending, then position, so equal-confidence clusters resolve the same way every run. */
    static final Comparator<Detection> BY_CONFIDENCE = Comparator
            .comparingDouble(Detection::confidence).reversed()
            .thenComparingDouble(d -> d.bbox().x())
            .thenComparingDouble(d -> d.bbox().y());

    private NonMaxSuppression() {
    }

    /**
     * @param detections   input detections (not modified)
     * @param iouThreshold suppression threshold in [0,1]
     * @return survivors, grouped by class in declaration order and sorted by confidence within a class
     */
    public static List<Detection> apply(List<Detection> detections, double iouThreshold) {
        Map<DefectClass, List<Detection>> byClass = new EnumMap<>(DefectClass.class);
        for (Detection d : detections) {
            byClass.computeIfAbsent(d.defectClass(), k -> new ArrayList<>()).add(d);
        }

        List<Detection> kept = new ArrayList<>(detections.size());
        for (List<Detection> group : byClass.values()) {
            group.sort(BY_CONFIDENCE);
            List<Detection> survivors = new ArrayList<>();
            for (Detection candidate : group) {
                boolean suppressed = false;
                for (Detection keeper : survivors) {
                    if (keeper.bbox().iou(candidate.bbox()) >= iouThreshold) {
                        suppressed = true;
                        break;
                    }
                }
                if (!suppressed) {
                    survivors.add(candidate);
                }
            }
            kept.addAll(survivors);
        }
        return kept;
    }
}
