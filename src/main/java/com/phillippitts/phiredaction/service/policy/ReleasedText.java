package com.phillippitts.phiredaction.service.policy;

/**
 * Text cleared by the policy gate.
 *
 * @param snapshotId    snapshot the text was derived from
 * @param destination   outbound consumer
 * @param text          released text
 * @param redacted      false only for the redact-before-send passthrough
 * @param acceptedCount entities masked
 * @param rejectedCount entities left as spoken
 */
public record ReleasedText(
        String snapshotId,
        String destination,
        String text,
        boolean redacted,
        int acceptedCount,
        int rejectedCount
) {}
