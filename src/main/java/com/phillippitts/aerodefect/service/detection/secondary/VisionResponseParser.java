package com.phillippitts.aerodefect.service.detection.secondary;

import com.phillippitts.aerodefect.domain.BoundingBox;
import com.phillippitts.aerodefect.domain.DefectClass;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSource;
import com.phillippitts.aerodefect.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tolerant parser for the remote model's free-text answer.
 *
 * <p>Accepts a bare JSON array, the same array inside markdown code fences or surrounding prose,
 * and an object wrapping the array under {@code defects} or {@code detections}. Each record is
 * validated on its own; bad records (unknown class, missing fields, no area) are logged and dropped.
 * Confidence is clamped to [0,1] and boxes are clamped to the image.
 *
 * <p>An answer with no recognizable JSON is reported as empty {@link Optional} so the caller can
 * treat it as a malformed (retryable) response. An empty array is a valid "no defects" answer.
 */
final class VisionResponseParser {

    private static final Logger LOG = LogManager.getLogger(VisionResponseParser.class);

    private static final int PREVIEW_CHARS = 120;

    private VisionResponseParser() {
    }

    static Optional<List<Detection>> parse(String text, int imageWidth, int imageHeight) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<JSONArray> records = locateArray(stripFences(text.strip()));
        if (records.isEmpty()) {
            LOG.warn("No JSON detections found in vision response: {}", LogSanitizer.preview(text, PREVIEW_CHARS));
            return Optional.empty();
        }

        JSONArray array = records.get();
        List<Detection> detections = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object item = array.opt(i);
            if (!(item instanceof JSONObject record)) {
                LOG.warn("Skipping non-object detection entry at index {}", i);
                continue;
            }
            toDetection(record, imageWidth, imageHeight).ifPresent(detections::add);
        }
        LOG.info("Parsed {} detection(s) from vision response ({} entries)", detections.size(), array.length());
        return Optional.of(detections);
    }

    static String stripFences(String text) {
        String s = text;
        int open = s.indexOf("```");
        if (open >= 0) {
            int bodyStart = s.indexOf('\n', open);
            int close = s.indexOf("```", open + 3);
            if (bodyStart >= 0 && (close < 0 || bodyStart < close)) {
                s = close > 0 ? s.substring(bodyStart + 1, close) : s.substring(bodyStart + 1);
            } else if (close > open) {
                s = s.substring(open + 3, close);
            }
            if (s.startsWith("json")) {
                s = s.substring(4);
            }
        }
        return s.strip();
    }

    private static Optional<JSONArray> locateArray(String text) {
        if (text.startsWith("{")) {
            Optional<JSONArray> wrapped = unwrap(text);
            if (wrapped.isPresent()) {
                return wrapped;
            }
        }
        int end = text.lastIndexOf(']');
        for (int start = text.indexOf('['); start >= 0 && start < end; start = text.indexOf('[', start + 1)) {
            try {
                return Optional.of(new JSONArray(text.substring(start, end + 1)));
            } catch (JSONException e) {
                LOG.debug("Bracketed text at {} is not a JSON array: {}", start, e.getMessage());
            }
        }
        int objStart = text.indexOf('{');
        int objEnd = text.lastIndexOf('}');
        if (objStart >= 0 && objEnd > objStart) {
            return unwrap(text.substring(objStart, objEnd + 1));
        }
        return Optional.empty();
    }

    private static Optional<JSONArray> unwrap(String objectText) {
        try {
            JSONObject obj = new JSONObject(objectText);
            for (String key : new String[] {"defects", "detections"}) {
                JSONArray arr = obj.optJSONArray(key);
                if (arr != null) {
                    return Optional.of(arr);
                }
            }
            return Optional.empty();
        } catch (JSONException e) {
            LOG.debug("Braced text is not a JSON object: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Detection> toDetection(JSONObject record, int imageWidth, int imageHeight) {
        String label = record.optString("class", null);
        Optional<DefectClass> defectClass = DefectClass.fromLabel(label);
        if (defectClass.isEmpty()) {
            LOG.warn("Unknown defect class '{}', skipping", LogSanitizer.preview(label, 40));
            return Optional.empty();
        }
        double confidence = record.optDouble("confidence", Double.NaN);
        if (Double.isNaN(confidence)) {
            LOG.warn("Detection of class {} has no numeric confidence, skipping", defectClass.get().wireName());
            return Optional.empty();
        }
        Optional<BoundingBox> box = readBox(record.opt("bbox"));
        if (box.isEmpty()) {
            LOG.warn("Detection of class {} has no usable bbox, skipping", defectClass.get().wireName());
            return Optional.empty();
        }
        BoundingBox clamped = box.get().clampTo(imageWidth, imageHeight);
        if (!clamped.isWellFormed()) {
            LOG.warn("Detection of class {} lies outside the image, skipping", defectClass.get().wireName());
            return Optional.empty();
        }
        String description = record.optString("description", null);
        return Optional.of(new Detection(defectClass.get(), clamp01(confidence), clamped,
                DetectionSource.SECONDARY, description));
    }

    private static Optional<BoundingBox> readBox(Object raw) {
        double x;
        double y;
        double w;
        double h;
        if (raw instanceof JSONObject o) {
            x = o.optDouble("x", Double.NaN);
            y = o.optDouble("y", Double.NaN);
            w = o.optDouble("width", Double.NaN);
            h = o.optDouble("height", Double.NaN);
        } else if (raw instanceof JSONArray a && a.length() == 4) {
            x = a.optDouble(0, Double.NaN);
            y = a.optDouble(1, Double.NaN);
            w = a.optDouble(2, Double.NaN);
            h = a.optDouble(3, Double.NaN);
        } else {
            return Optional.empty();
        }
        BoundingBox box = new BoundingBox(x, y, w, h);
        return box.isWellFormed() ? Optional.of(box) : Optional.empty();
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
