package com.phillippitts.phiredaction.service.snapshot;

import com.phillippitts.phiredaction.domain.DiffEntry;

import java.util.List;

/**
 * Renders span diff entries as a hunk-per-entity text diff for reviewers.
 *
 * <pre>
 * &#64;&#64; e-2 phone [19,31) &#64;&#64;
 * -555-123-4567
 * +[PHONE]
 * </pre>
 */
final class PreviewDiffRenderer {

    private PreviewDiffRenderer() {
        // Utility class - prevent instantiation
    }

    static String render(List<DiffEntry> entries) {
        StringBuilder sb = new StringBuilder();
        for (DiffEntry d : entries) {
            sb.append("@@ ").append(d.entityId()).append(' ').append(d.label().wireName())
                    .append(" [").append(d.start()).append(',').append(d.end()).append(") @@\n")
                    .append('-').append(d.original()).append('\n')
                    .append('+').append(d.placeholder()).append('\n');
        }
        return sb.toString();
    }
}
