/**
 * Immutable domain models for defect detection.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.aerodefect.domain.Detection} - one predicted defect with class,
 *       confidence, box and source</li>
 *   <li>{@link com.phillippitts.aerodefect.domain.DetectionSet} - everything one detector returned
 *       for one job, or its error</li>
 *   <li>{@link com.phillippitts.aerodefect.domain.EnsembleResult} - the merged result handed back to
 *       callers</li>
 * </ul>
 */
package com.phillippitts.aerodefect.domain;
