package com.phillippitts.aerodefect.service.detection.secondary;

/**
 * Typed outcome of one remote call. Retry decisions read {@link #isRetryable()} instead of catching
 * exceptions.
 *
 * @param status     outcome class
 * @param content    model text on success, null otherwise
 * @param httpStatus HTTP status code when one was received, 0 otherwise
 * @param error      failure description, null on success
 */
public record VisionCallResult(Status status, String content, int httpStatus, String error) {

    public enum Status {
        SUCCESS(false),
        TIMEOUT(true),
        TRANSPORT_ERROR(true),
        SERVER_ERROR(true),
        RATE_LIMITED(true),
        EMPTY_RESPONSE(true),
        MALFORMED_RESPONSE(true),
        CLIENT_ERROR(false),
        NOT_CONFIGURED(false);

        private final boolean retryable;

        Status(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    public static VisionCallResult success(String content) {
        return new VisionCallResult(Status.SUCCESS, content, 200, null);
    }

    public static VisionCallResult failure(Status status, String error) {
        return new VisionCallResult(status, null, 0, error);
    }

    public static VisionCallResult httpFailure(Status status, int httpStatus, String error) {
        return new VisionCallResult(status, null, httpStatus, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRetryable() {
        return status.isRetryable();
    }

    /**
     * One-line summary for logs and failure messages.
     */
    public String describe() {
        if (isSuccess()) {
            return "SUCCESS";
        }
        String code = httpStatus > 0 ? " HTTP " + httpStatus : "";
        return status + code + (error == null ? "" : ": " + error);
    }
}
