/**
 * Combining the two detectors' outputs: pairing, weighted class voting and class-scoped
 * non-maximum suppression.
 */
package com.phillippitts.aerodefect.service.ensemble;
