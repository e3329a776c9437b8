package com.phillippitts.aerodefect.service.detection.primary;

import com.phillippitts.aerodefect.domain.BoundingBox;
import com.phillippitts.aerodefect.domain.DefectClass;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSource;
import com.phillippitts.aerodefect.service.ensemble.NonMaxSuppression;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a YOLOv8 output tensor into {@link Detection}s.
 *
 * <p>Expected layout is {@code [4 + classes][anchors]} with rows {@code cx, cy, w, h} followed by one
 * score row per class. The transposed {@code [anchors][4 + classes]} export is detected and handled.
 * Candidates below the confidence threshold are skipped before any box math.
 */
final class YoloOutputDecoder {

    private final List<DefectClass> classes;
    private final double confidenceThreshold;
    private final double nmsThreshold;

    /**
     * @param classes             class for each model output index; null entries mark indices to ignore
     * @param confidenceThreshold minimum class score
     * @param nmsThreshold        per-class suppression IoU
     */
    YoloOutputDecoder(List<DefectClass> classes, double confidenceThreshold, double nmsThreshold) {
        this.classes = new ArrayList<>(classes);
        this.confidenceThreshold = confidenceThreshold;
        this.nmsThreshold = nmsThreshold;
    }

    /**
     * Builds the index table from configured labels, falling back to enum order when none are configured.
     */
    static List<DefectClass> resolveClasses(List<String> classNames) {
        List<DefectClass> resolved = new ArrayList<>();
        if (classNames.isEmpty()) {
            resolved.addAll(List.of(DefectClass.values()));
            return resolved;
        }
        for (String name : classNames) {
            resolved.add(DefectClass.fromLabel(name).orElse(null));
        }
        return resolved;
    }

    List<Detection> decode(float[][] output, Letterbox letterbox) {
        float[][] rows = isChannelsFirst(output) ? output : transpose(output);
        if (rows.length < 5) {
            throw new IllegalArgumentException("model output has " + rows.length + " channels, expected 4 + classes");
        }
        int numClasses = Math.min(rows.length - 4, classes.size());
        int numAnchors = rows[0].length;

        List<Detection> candidates = new ArrayList<>();
        for (int i = 0; i < numAnchors; i++) {
            float best = -Float.MAX_VALUE;
            int bestIndex = -1;
            for (int c = 0; c < numClasses; c++) {
                float score = rows[4 + c][i];
                if (score > best) {
                    best = score;
                    bestIndex = c;
                }
            }
            if (bestIndex < 0 || best < confidenceThreshold) {
                continue;
            }
            DefectClass defectClass = classes.get(bestIndex);
            if (defectClass == null) {
                continue;
            }
            BoundingBox box = letterbox.toSource(rows[0][i], rows[1][i], rows[2][i], rows[3][i]);
            if (!box.isWellFormed()) {
                continue;
            }
            double confidence = Math.min(1.0, best);
            candidates.add(new Detection(defectClass, confidence, box, DetectionSource.PRIMARY));
        }
        return NonMaxSuppression.apply(candidates, nmsThreshold);
    }

    private boolean isChannelsFirst(float[][] output) {
        if (output.length == 0 || output[0].length == 0) {
            throw new IllegalArgumentException("empty model output");
        }
        // Channel count is small (4 + classes); anchor count is in the thousands.
        return output.length <= output[0].length;
    }

    private static float[][] transpose(float[][] m) {
        float[][] t = new float[m[0].length][m.length];
        for (int r = 0; r < m.length; r++) {
            for (int c = 0; c < m[r].length; c++) {
                t[c][r] = m[r][c];
            }
        }
        return t;
    }
}
