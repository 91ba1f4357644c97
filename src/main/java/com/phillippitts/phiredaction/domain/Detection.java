package com.phillippitts.phiredaction.domain;

import java.util.List;
import java.util.Objects;

/**
 * A raw finding from one of the detection lanes, before the merger assigns it an entity id.
 *
 * @param label      PHI category
 * @param text       matched text (equal to {@code buffer.substring(start, end)})
 * @param start      inclusive buffer offset
 * @param end        exclusive buffer offset
 * @param confidence detector confidence in [0,1]
 * @param method     lane that produced the finding
 * @param contexts   provenance entries
 */
public record Detection(
        PhiLabel label,
        String text,
        int start,
        int end,
        double confidence,
        DetectionMethod method,
        List<EntityContext> contexts
) {

    public Detection {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(method, "method");
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + "," + end + ")");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return start < otherEnd && otherStart < end;
    }
}
