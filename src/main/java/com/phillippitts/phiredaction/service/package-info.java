/**
 * Service layer of the redaction engine.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.buffer} - append-only chunk buffer and chunk validation</li>
 *   <li>{@code service.detect} - fast pattern lane, contextual slow lane and the model watchdog</li>
 *   <li>{@code service.merge} - reconciliation of detections into the entity index</li>
 *   <li>{@code service.session} - sessions, entity index and the session registry</li>
 *   <li>{@code service.slowlane} - slow-lane cadence, coalescing and failure accounting</li>
 *   <li>{@code service.snapshot}, {@code service.apply} - review snapshots and their application</li>
 *   <li>{@code service.policy} - the policy gate, the only egress path for text</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are Spring beans with constructor injection; per-session state lives in
 *       {@code RedactionSession}, never in the beans</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>No service logs transcript text; {@code LogSanitizer} renders it as length and hash</li>
 * </ul>
 *
 * @see com.phillippitts.phiredaction.service.RedactionService
 * @since 1.0
 */
package com.phillippitts.phiredaction.service;
