package com.phillippitts.aerodefect.service.preprocessing;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/**
 * Output of {@link ImagePreprocessor}: the decoded original, its normalized variant, and quality data.
 *
 * <p>Both images are {@code TYPE_INT_RGB} and share the original pixel dimensions; detectors report
 * boxes in that space. Treated as read-only once built, so it can be shared by both detector branches.
 *
 * @param original     decoded image as uploaded; the remote model analyzes this one
 * @param normalized   contrast-equalized and glare/shadow-corrected image fed to the local model
 * @param qualityScore sharpness plus brightness score in [0,100]
 * @param warnings     non-fatal findings such as a low quality score
 */
public record PreprocessedImage(
        BufferedImage original,
        BufferedImage normalized,
        double qualityScore,
        List<String> warnings
) {

    public PreprocessedImage {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(normalized, "normalized");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public int width() {
        return original.getWidth();
    }

    public int height() {
        return original.getHeight();
    }
}
