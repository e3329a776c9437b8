package com.phillippitts.aerodefect.service.detection.secondary;

import java.util.Objects;

/**
 * One call to the remote vision model.
 *
 * @param prompt      instruction text
 * @param imageBase64 base64-encoded JPEG
 */
public record VisionRequest(String prompt, String imageBase64) {

    public VisionRequest {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(imageBase64, "imageBase64");
    }

    public String imageDataUrl() {
        return "data:image/jpeg;base64," + imageBase64;
    }
}
