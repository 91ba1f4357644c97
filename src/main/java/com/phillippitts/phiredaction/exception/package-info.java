/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.phiredaction.exception.PhiRedactionException} - Base exception</li>
 *   <li>{@link com.phillippitts.phiredaction.exception.ChunkValidationException} and
 *       {@link com.phillippitts.phiredaction.exception.UnknownEntityException} - validation errors,
 *       surfaced immediately, never retried</li>
 *   <li>{@link com.phillippitts.phiredaction.exception.DetectorUnavailableException} and
 *       {@link com.phillippitts.phiredaction.exception.DetectorTimeoutException} - slow-lane failures,
 *       recovered locally by degraded mode</li>
 *   <li>{@link com.phillippitts.phiredaction.exception.StaleSnapshotException} - a snapshot whose offsets
 *       no longer match its buffer</li>
 *   <li>{@link com.phillippitts.phiredaction.exception.EgressBlockedException} - policy gate refusal</li>
 *   <li>{@link com.phillippitts.phiredaction.exception.SessionNotFoundException} and
 *       {@link com.phillippitts.phiredaction.exception.SnapshotNotFoundException} - unknown references</li>
 * </ul>
 *
 * <p>All messages contain identifiers only. HTTP mapping lives in
 * {@code presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.phiredaction.exception;
