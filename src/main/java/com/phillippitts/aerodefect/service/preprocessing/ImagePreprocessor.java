package com.phillippitts.aerodefect.service.preprocessing;

import com.phillippitts.aerodefect.config.properties.PreprocessingProperties;
import com.phillippitts.aerodefect.exception.PreprocessingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Validates and normalizes an inspection image before any detector sees it.
 *
 * <p>Pipeline, all on OpenCV matrices:
 * <ol>
 *   <li>Decode with {@code imdecode}; undecodable payloads fail with {@link PreprocessingException}</li>
 *   <li>Check both dimensions against {@code [minDimension, maxDimension]}</li>
 *   <li>Score quality on the original (see {@link ImageQualityScorer}); a score below the floor is a
 *       warning, not a failure</li>
 *   <li>CLAHE on the L channel in LAB space, 8x8 tiles, clip limit from configuration</li>
 *   <li>Bilateral filter (d=9, sigma 75/75), plus highlight reduction for glare (mean luma above 180)
 *       or shadow lift (mean luma below 80)</li>
 * </ol>
 *
 * <p>Native memory of every intermediate matrix is released before returning. No shared state; safe
 * for concurrent use.
 */
@Component
public class ImagePreprocessor {

    private static final Logger LOG = LogManager.getLogger(ImagePreprocessor.class);

    static final double GLARE_LUMA = 180.0;
    static final double SHADOW_LUMA = 80.0;

    private static final int CLAHE_TILES = 8;
    private static final int BILATERAL_DIAMETER = 9;
    private static final double BILATERAL_SIGMA = 75.0;

    private final PreprocessingProperties properties;

    public ImagePreprocessor(PreprocessingProperties properties) {
        this.properties = Objects.requireNonNull(properties);
    }

    /**
     * Decodes, validates and normalizes raw image bytes.
     *
     * @param imageBytes encoded image (JPEG, PNG, BMP, ...)
     * @return normalized image with quality score and warnings
     * @throws PreprocessingException if bytes are empty or undecodable, or dimensions are out of range
     */
    public PreprocessedImage preprocess(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new PreprocessingException("image payload is empty");
        }
        try (PointerScope scope = new PointerScope()) {
            Mat decoded;
            try {
                decoded = opencv_imgcodecs.imdecode(new Mat(imageBytes), opencv_imgcodecs.IMREAD_COLOR);
            } catch (RuntimeException e) {
                throw new PreprocessingException("image could not be decoded", e);
            }
            if (decoded == null || decoded.empty()) {
                throw new PreprocessingException("unsupported or corrupt image data (" + imageBytes.length + " bytes)");
            }
            validateDimensions(decoded.cols(), decoded.rows());
            return normalize(decoded);
        }
    }

    /**
     * Validates and normalizes an already decoded image.
     *
     * @throws PreprocessingException if dimensions are out of range
     */
    public PreprocessedImage preprocess(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        validateDimensions(image.getWidth(), image.getHeight());
        try (PointerScope scope = new PointerScope()) {
            return normalize(OpenCvImages.toMat(image));
        }
    }

    private PreprocessedImage normalize(Mat bgr) {
        double quality = ImageQualityScorer.score(bgr);

        List<String> warnings = new ArrayList<>();
        if (quality < properties.qualityFloor()) {
            warnings.add(String.format(Locale.ROOT, "Low image quality score %.1f (floor %.1f)",
                    quality, properties.qualityFloor()));
        }

        Mat equalized = equalizeLuma(bgr, properties.clipLimit());
        Mat filtered = adaptiveFilter(equalized);

        LOG.info("Preprocessing complete: {}x{}, quality={}", bgr.cols(), bgr.rows(),
                String.format(Locale.ROOT, "%.2f", quality));
        return new PreprocessedImage(OpenCvImages.toBufferedImage(bgr), OpenCvImages.toBufferedImage(filtered),
                quality, warnings);
    }

    void validateDimensions(int width, int height) {
        int min = properties.minDimension();
        int max = properties.maxDimension();
        if (width < min || height < min) {
            throw new PreprocessingException(width, height, "dimensions too small, minimum " + min + "x" + min);
        }
        if (width > max || height > max) {
            throw new PreprocessingException(width, height, "dimensions too large, maximum " + max + "x" + max);
        }
    }

    /**
     * Contrast-limited adaptive histogram equalization of lightness. Chroma (the A and B channels)
     * is left untouched.
     */
    static Mat equalizeLuma(Mat bgr, double clipLimit) {
        Mat lab = new Mat();
        opencv_imgproc.cvtColor(bgr, lab, opencv_imgproc.COLOR_BGR2Lab);
        MatVector channels = new MatVector();
        opencv_core.split(lab, channels);

        Mat lightness = new Mat();
        opencv_imgproc.createCLAHE(clipLimit, new Size(CLAHE_TILES, CLAHE_TILES)).apply(channels.get(0), lightness);
        channels.put(0, lightness);

        Mat merged = new Mat();
        opencv_core.merge(channels, merged);
        Mat out = new Mat();
        opencv_imgproc.cvtColor(merged, out, opencv_imgproc.COLOR_Lab2BGR);
        return out;
    }

    static Mat adaptiveFilter(Mat bgr) {
        double meanLuma = ImageQualityScorer.meanLuma(bgr);
        Mat smoothed = new Mat();
        opencv_imgproc.bilateralFilter(bgr, smoothed, BILATERAL_DIAMETER, BILATERAL_SIGMA, BILATERAL_SIGMA);

        if (meanLuma > GLARE_LUMA) {
            LOG.debug("High brightness detected (mean luma {}), applying glare reduction", (int) meanLuma);
            Mat dimmed = new Mat();
            smoothed.convertTo(dimmed, -1, 0.8, -20);
            return dimmed;
        }
        if (meanLuma < SHADOW_LUMA) {
            LOG.debug("Low brightness detected (mean luma {}), applying shadow enhancement", (int) meanLuma);
            Mat lifted = new Mat();
            smoothed.convertTo(lifted, -1, 1.2, 20);
            return lifted;
        }
        return smoothed;
    }
}
