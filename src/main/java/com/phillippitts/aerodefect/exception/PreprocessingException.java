package com.phillippitts.aerodefect.exception;

/**
 * Thrown when an inspection image cannot be decoded or its pixel dimensions fall outside
 * the accepted range. Fatal for the job: no detector is invoked.
 */
public class PreprocessingException extends AeroDefectException {

    private final int width;
    private final int height;
    private final String reason;

    public PreprocessingException(String reason) {
        super("Invalid inspection image: " + reason);
        this.width = 0;
        this.height = 0;
        this.reason = reason;
    }

    public PreprocessingException(String reason, Throwable cause) {
        super("Invalid inspection image: " + reason, cause);
        this.width = 0;
        this.height = 0;
        this.reason = reason;
    }

    public PreprocessingException(int width, int height, String reason) {
        super("Invalid inspection image (" + width + "x" + height + "): " + reason);
        this.width = width;
        this.height = height;
        this.reason = reason;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public String getReason() {
        return reason;
    }
}
