/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.aerodefect.exception.AeroDefectException} - base for all application errors</li>
 *   <li>{@link com.phillippitts.aerodefect.exception.PreprocessingException} - bad dimensions or undecodable
 *       image; fails the job before any detector runs</li>
 *   <li>{@link com.phillippitts.aerodefect.exception.DetectorUnavailableException} - a detector backend is
 *       unreachable; retried for the remote detector only, never fatal alone</li>
 *   <li>{@link com.phillippitts.aerodefect.exception.DetectionTimeoutException} - a branch missed the job
 *       deadline; triggers degraded mode</li>
 *   <li>{@link com.phillippitts.aerodefect.exception.AggregationException} - malformed geometry reached the
 *       aggregator; the detection is dropped with a warning</li>
 *   <li>{@link com.phillippitts.aerodefect.exception.InferenceUnavailableException} - both detectors
 *       unusable; the job fails</li>
 * </ul>
 *
 * <p>HTTP mapping lives in {@code GlobalExceptionHandler}.
 */
package com.phillippitts.aerodefect.exception;
