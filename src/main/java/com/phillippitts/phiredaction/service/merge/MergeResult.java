package com.phillippitts.phiredaction.service.merge;

import com.phillippitts.phiredaction.domain.Entity;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one merge.
 *
 * @param entities     active entities after the merge, pairwise non-overlapping, insertion-ordered
 * @param added        entities created by this merge (new ids)
 * @param superseded   previously active entities displaced by a stronger detection
 * @param supersededBy superseded id to the id of the entity that displaced it
 * @param duplicates   detections folded into an existing entity of the same label
 * @param rejected     detections that lost against an overlapping entity
 */
public record MergeResult(
        List<Entity> entities,
        List<Entity> added,
        List<Entity> superseded,
        Map<String, String> supersededBy,
        int duplicates,
        int rejected
) {
    public MergeResult {
        entities = List.copyOf(entities);
        added = List.copyOf(added);
        superseded = List.copyOf(superseded);
        supersededBy = Map.copyOf(supersededBy);
    }

    public boolean changed() {
        return !added.isEmpty() || duplicates > 0 || rejected > 0;
    }
}
