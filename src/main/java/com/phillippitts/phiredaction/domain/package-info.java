/**
 * Immutable domain model of the redaction engine: chunks, detections, entities, snapshots.
 *
 * <p>Records in this package carry PHI. Their {@code toString()} output must never be logged;
 * use {@link com.phillippitts.phiredaction.util.LogSanitizer} for diagnostics.
 *
 * @since 1.0
 */
package com.phillippitts.phiredaction.domain;
