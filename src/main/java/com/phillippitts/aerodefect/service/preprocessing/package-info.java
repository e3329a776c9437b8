/**
 * Image validation, normalization and quality scoring. Pure transforms with no shared state.
 */
package com.phillippitts.aerodefect.service.preprocessing;
