package com.phillippitts.phiredaction.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A detected PHI span registered in a session's entity index.
 *
 * <p>Entities are immutable; merging produces a new instance through {@link #withContexts(List)}
 * while keeping the id.
 *
 * @param id         stable identifier assigned on first insertion
 * @param label      PHI category
 * @param text       original text of the span
 * @param start      inclusive buffer offset
 * @param end        exclusive buffer offset
 * @param confidence confidence in [0,1]
 * @param method     lane that produced the winning detection
 * @param contexts   provenance entries, deduplicated, in arrival order
 */
public record Entity(
        String id,
        PhiLabel label,
        String text,
        int start,
        int end,
        double confidence,
        DetectionMethod method,
        List<EntityContext> contexts
) {

    public Entity {
        Objects.requireNonNull(id, "id");
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

    public static Entity from(String id, Detection detection) {
        return new Entity(id, detection.label(), detection.text(), detection.start(), detection.end(),
                detection.confidence(), detection.method(), detection.contexts());
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return start < otherEnd && otherStart < end;
    }

    public boolean contains(int otherStart, int otherEnd) {
        return start <= otherStart && otherEnd <= end;
    }

    public int length() {
        return end - start;
    }

    /**
     * Returns a copy whose contexts are the union of this entity's and {@code additional}.
     */
    public Entity withContexts(List<EntityContext> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        LinkedHashSet<EntityContext> union = new LinkedHashSet<>(contexts);
        union.addAll(additional);
        if (union.size() == contexts.size()) {
            return this;
        }
        return new Entity(id, label, text, start, end, confidence, method, new ArrayList<>(union));
    }
}
