package com.phillippitts.aerodefect.presentation.exception;

import com.phillippitts.aerodefect.exception.CapacityExceededException;
import com.phillippitts.aerodefect.exception.InferenceUnavailableException;
import com.phillippitts.aerodefect.exception.PreprocessingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with a stable error code. Detector error text can
 * carry endpoint details, so it is logged but never returned to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String INVALID_IMAGE = "INVALID_IMAGE";
    static final String INFERENCE_UNAVAILABLE = "INFERENCE_UNAVAILABLE";
    static final String CAPACITY_EXCEEDED = "CAPACITY_EXCEEDED";

    /**
     * Client error - undecodable image or dimensions out of range (HTTP 400).
     */
    @ExceptionHandler(PreprocessingException.class)
    ResponseEntity<ApiError> handleInvalidImage(PreprocessingException ex) {
        LOG.warn("Invalid image: {}x{}, reason={}", ex.getWidth(), ex.getHeight(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                INVALID_IMAGE,
                "Invalid inspection image",
                ex.getMessage(),
                Instant.now()
            ));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    ResponseEntity<ApiError> handleMissingImage(MissingServletRequestPartException ex) {
        LOG.warn("Detection request without '{}' part", ex.getRequestPartName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                INVALID_IMAGE,
                "No image provided",
                "Send the image as multipart part '" + ex.getRequestPartName() + "'",
                Instant.now()
            ));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ApiError(
                INVALID_IMAGE,
                "Image too large",
                "Maximum upload size exceeded",
                Instant.now()
            ));
    }

    /**
     * Both detectors failed - retry possible (HTTP 503).
     */
    @ExceptionHandler(InferenceUnavailableException.class)
    ResponseEntity<ApiError> handleInferenceUnavailable(InferenceUnavailableException ex) {
        LOG.error("Inference unavailable: primary={}, secondary={}", ex.getPrimaryError(), ex.getSecondaryError());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                INFERENCE_UNAVAILABLE,
                "All inference backends unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Queue timeout elapsed - retry possible (HTTP 503).
     */
    @ExceptionHandler(CapacityExceededException.class)
    ResponseEntity<ApiError> handleCapacity(CapacityExceededException ex) {
        LOG.warn("Capacity exceeded: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                CAPACITY_EXCEEDED,
                "Inspection service busy",
                "Please retry later",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
