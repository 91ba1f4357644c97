/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.phiredaction.config.ThreadPoolConfig} - slow-lane and detector
 *       executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.phiredaction.config.detection.DetectionConfig} - context model and
 *       clock beans</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code phi.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.phiredaction.config;
