/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /ml/detect} - multipart {@code image} (plus optional {@code inspectionId}),
 *       returns {@link com.phillippitts.aerodefect.presentation.controller.DetectionResponse}</li>
 * </ul>
 *
 * <p>Health and metrics are served by Spring Boot Actuator ({@code /actuator/health},
 * {@code /actuator/prometheus}). Exceptions are rendered by
 * {@link com.phillippitts.aerodefect.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.aerodefect.presentation.controller;
