package com.phillippitts.phiredaction.domain;

/**
 * One replaced span in a snapshot preview.
 *
 * @param entityId    entity the span belongs to
 * @param label       PHI category
 * @param start       inclusive offset in the original text
 * @param end         exclusive offset in the original text
 * @param original    original text of the span
 * @param placeholder token that replaces it in the preview
 */
public record DiffEntry(
        String entityId,
        PhiLabel label,
        int start,
        int end,
        String original,
        String placeholder
) {}
