package com.phillippitts.aerodefect.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link DetectorUnavailableException} with diagnostic context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw DetectorExceptionBuilder.create("Remote vision call failed")
 *         .detector("secondary")
 *         .attempts(3)
 *         .durationMs(4200)
 *         .metadata("lastStatus", "SERVER_ERROR")
 *         .build();
 * </pre>
 *
 * <p>Produces messages of the form
 * {@code {message} (attempts={n}, durationMs={ms}, {key}={value}, ...)}.
 */
public final class DetectorExceptionBuilder {

    private final String message;
    private String detectorName;
    private Throwable cause;
    private Integer attempts;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private DetectorExceptionBuilder(String message) {
        this.message = message;
    }

    public static DetectorExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new DetectorExceptionBuilder(message);
    }

    public DetectorExceptionBuilder detector(String detectorName) {
        this.detectorName = detectorName;
        return this;
    }

    public DetectorExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public DetectorExceptionBuilder attempts(int attempts) {
        this.attempts = attempts;
        return this;
    }

    public DetectorExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key/value pair to the message. Null keys or values are ignored.
     */
    public DetectorExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public DetectorUnavailableException build() {
        String detailed = buildDetailedMessage();
        String detector = detectorName != null ? detectorName : "unknown";
        if (cause != null) {
            return new DetectorUnavailableException(detailed, detector, cause);
        }
        return new DetectorUnavailableException(detailed, detector);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (attempts != null) {
            details.put("attempts", String.valueOf(attempts));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
