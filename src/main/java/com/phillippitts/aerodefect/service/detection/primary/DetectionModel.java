package com.phillippitts.aerodefect.service.detection.primary;

import com.phillippitts.aerodefect.domain.Detection;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * A loaded local object-detection model.
 *
 * <p>Implementations are read-only after construction and must support concurrent
 * {@link #predict(BufferedImage)} calls without external locking.
 */
public interface DetectionModel extends AutoCloseable {

    /**
     * Runs inference on one image.
     *
     * @param image normalized RGB image
     * @return detections in the image's pixel space, tagged {@code PRIMARY}, in no particular order
     * @throws com.phillippitts.aerodefect.exception.DetectorUnavailableException if inference fails
     */
    List<Detection> predict(BufferedImage image);

    /**
     * @return short identifier used in logs and health output
     */
    String name();

    /**
     * Releases native resources. Never throws.
     */
    @Override
    void close();
}
