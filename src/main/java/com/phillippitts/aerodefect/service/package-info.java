/**
 * Inspection pipeline services.
 *
 * <p>Sub-packages, in data-flow order:
 * <ul>
 *   <li>{@code preprocessing} - decode, validate and normalize the image, score its quality</li>
 *   <li>{@code detection.primary} - local ONNX object detector</li>
 *   <li>{@code detection.secondary} - remote vision-language model with retry/backoff</li>
 *   <li>{@code ensemble} - merge, vote and deduplicate the two detection sets</li>
 *   <li>{@code orchestration} - admission control, job state machine, deadline handling</li>
 *   <li>{@code metrics}, {@code health} - Micrometer instrumentation and actuator health</li>
 * </ul>
 */
package com.phillippitts.aerodefect.service;
