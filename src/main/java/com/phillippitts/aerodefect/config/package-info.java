/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.aerodefect.config.ThreadPoolConfig} - bounded executors for the
 *       local and remote detector branches of each job, with Log4j2 context propagation</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} records for every tunable</li>
 *   <li>{@code config.detection} - detector backend wiring (ONNX model handle, vision HTTP client)</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.aerodefect.config;
