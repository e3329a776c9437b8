package com.phillippitts.aerodefect.exception;

/**
 * Thrown when the local detection model weights cannot be found at the configured path.
 */
public class ModelNotFoundException extends DetectorUnavailableException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath, String detectorName) {
        super("Detection model not found at path: " + modelPath, detectorName);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
