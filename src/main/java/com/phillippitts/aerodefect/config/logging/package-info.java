/**
 * Logging infrastructure: request-scoped Log4j2 {@code ThreadContext} values.
 */
package com.phillippitts.aerodefect.config.logging;
