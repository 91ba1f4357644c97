package com.phillippitts.phiredaction.domain;

/**
 * Output of applying an accept/reject selection to a snapshot.
 *
 * @param snapshotId     snapshot the text was derived from
 * @param redactedText   final redacted text
 * @param acceptedCount  number of entities masked
 * @param rejectedCount  number of entities left untouched
 * @param originalLength character count before masking
 * @param redactedLength character count after masking
 */
public record ApplyResult(
        String snapshotId,
        String redactedText,
        int acceptedCount,
        int rejectedCount,
        int originalLength,
        int redactedLength
) {}
