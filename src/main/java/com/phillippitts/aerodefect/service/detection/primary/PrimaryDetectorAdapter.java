package com.phillippitts.aerodefect.service.detection.primary;

import com.phillippitts.aerodefect.config.properties.PrimaryDetectorProperties;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSet;
import com.phillippitts.aerodefect.exception.DetectorUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Runs the local detection model for one job.
 *
 * <p>Never throws for detector problems: a missing model, a native crash or malformed output comes
 * back as a failed {@link DetectionSet} and the coordinator decides what that means for the job.
 * Output is filtered at the configured confidence threshold and sorted by confidence descending.
 */
@Component
public class PrimaryDetectorAdapter {

    private static final Logger LOG = LogManager.getLogger(PrimaryDetectorAdapter.class);

    public static final String DETECTOR_NAME = "primary";

    private static final Comparator<Detection> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(Detection::confidence).reversed();

    private final ModelHandle modelHandle;
    private final double confidenceThreshold;

    public PrimaryDetectorAdapter(ModelHandle modelHandle, PrimaryDetectorProperties properties) {
        this.modelHandle = Objects.requireNonNull(modelHandle);
        this.confidenceThreshold = properties.confidenceThreshold();
    }

    public DetectionSet detect(BufferedImage image) {
        long start = System.nanoTime();
        try {
            List<Detection> raw = modelHandle.get().predict(image);
            List<Detection> kept = new ArrayList<>(raw.size());
            for (Detection d : raw) {
                if (d.confidence() >= confidenceThreshold) {
                    kept.add(d);
                }
            }
            kept.sort(BY_CONFIDENCE_DESC);
            long latency = elapsedMs(start);
            LOG.debug("Primary detector returned {} detections ({} raw) in {} ms", kept.size(), raw.size(), latency);
            return DetectionSet.success(kept, latency);
        } catch (DetectorUnavailableException e) {
            long latency = elapsedMs(start);
            LOG.warn("Primary detector unavailable after {} ms: {}", latency, e.getMessage());
            return DetectionSet.failure(e.getMessage(), latency);
        } catch (RuntimeException e) {
            long latency = elapsedMs(start);
            LOG.error("Primary detector failed after {} ms", latency, e);
            return DetectionSet.failure("primary inference error: " + e.getClass().getSimpleName()
                    + (e.getMessage() == null ? "" : " - " + e.getMessage()), latency);
        }
    }

    public boolean isModelLoaded() {
        return modelHandle.isLoaded();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
