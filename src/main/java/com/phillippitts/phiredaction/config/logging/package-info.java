/**
 * Logging configuration and request correlation.
 *
 * <p>{@link com.phillippitts.phiredaction.config.logging.MdcFilter} puts {@code requestId} and
 * {@code sessionId} into the Log4j2 ThreadContext; the pattern in {@code log4j2-spring.xml}
 * prints them on every line. Transcript and entity text are never logged.
 */
package com.phillippitts.phiredaction.config.logging;
