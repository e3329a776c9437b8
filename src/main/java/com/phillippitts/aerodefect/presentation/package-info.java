/**
 * HTTP layer: controllers and exception mapping.
 */
package com.phillippitts.aerodefect.presentation;
