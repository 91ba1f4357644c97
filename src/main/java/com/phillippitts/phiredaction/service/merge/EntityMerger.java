package com.phillippitts.phiredaction.service.merge;

import com.phillippitts.phiredaction.domain.Detection;
import com.phillippitts.phiredaction.domain.DetectionMethod;
import com.phillippitts.phiredaction.domain.Entity;
import com.phillippitts.phiredaction.domain.EntityContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reconciles the active entities of a session with a batch of new detections.
 *
 * <p>Rules, applied to each detection in a canonical order (confidence descending, contextual
 * lane first, then start, longer span first, label):
 * <ol>
 *   <li>Contained in an active entity with the same label: duplicate. Its contexts are unioned
 *       into that entity, which keeps its id.</li>
 *   <li>Overlapping active entities: the detection wins only if it beats every one of them
 *       (higher confidence, or equal confidence from the contextual lane against the pattern
 *       lane, or an equal tie from the same lane where the detection has the same label and
 *       strictly contains the entity's span). A winner becomes a new entity with a fresh id and inherits the contexts of the
 *       entities it supersedes. A loser is rejected and its contexts are unioned into the
 *       strongest entity it overlapped.</li>
 *   <li>Otherwise: added with a fresh id.</li>
 * </ol>
 *
 * <p>The merger holds no state; callers serialize merges per session and supply the id source.
 * Because the batch is sorted first, the result does not depend on the order in which the
 * detections were produced.
 */
@Component
public class EntityMerger {

    static final Comparator<Detection> CANONICAL_ORDER = Comparator
            .comparingDouble(Detection::confidence).reversed()
            .thenComparing(d -> d.method() == DetectionMethod.CONTEXTUAL ? 0 : 1)
            .thenComparingInt(Detection::start)
            .thenComparing(Comparator.comparingInt(Detection::end).reversed())
            .thenComparing(Detection::label)
            .thenComparing(Detection::text);

    /**
     * Merges {@code detections} into {@code current}.
     *
     * @param current active entities, pairwise non-overlapping
     * @param detections new findings from either lane
     * @param ids source of fresh, never reused entity ids
     * @return merged state; {@code current} is not modified
     */
    public MergeResult merge(List<Entity> current, List<Detection> detections, Supplier<String> ids) {
        // id -> entity, insertion ordered; replacing a value keeps its position
        LinkedHashMap<String, Entity> active = new LinkedHashMap<>();
        current.forEach(e -> active.put(e.id(), e));

        List<Entity> added = new ArrayList<>();
        List<Entity> superseded = new ArrayList<>();
        Map<String, String> supersededBy = new LinkedHashMap<>();
        int duplicates = 0;
        int rejected = 0;

        List<Detection> ordered = new ArrayList<>(detections);
        ordered.sort(CANONICAL_ORDER);

        for (Detection d : ordered) {
            List<Entity> overlapped = active.values().stream()
                    .filter(e -> e.overlaps(d.start(), d.end()))
                    .toList();

            if (overlapped.isEmpty()) {
                Entity created = Entity.from(ids.get(), d);
                active.put(created.id(), created);
                added.add(created);
                continue;
            }

            Optional<Entity> container = overlapped.stream()
                    .filter(e -> e.label() == d.label() && e.contains(d.start(), d.end()))
                    .findFirst();
            if (container.isPresent()) {
                Entity c = container.get();
                active.put(c.id(), c.withContexts(d.contexts()));
                duplicates++;
                continue;
            }

            if (overlapped.stream().allMatch(e -> beats(d, e))) {
                List<EntityContext> inherited = new ArrayList<>(d.contexts());
                overlapped.forEach(e -> inherited.addAll(e.contexts()));
                Entity winner = Entity.from(ids.get(), d).withContexts(inherited);
                for (Entity loser : overlapped) {
                    active.remove(loser.id());
                    superseded.add(loser);
                    supersededBy.put(loser.id(), winner.id());
                    // a superseded entity may itself have been added earlier in this batch
                    added.removeIf(a -> a.id().equals(loser.id()));
                }
                active.put(winner.id(), winner);
                added.add(winner);
            } else {
                Entity strongest = overlapped.stream()
                        .max(Comparator.comparingDouble(Entity::confidence))
                        .orElseThrow();
                active.put(strongest.id(), strongest.withContexts(d.contexts()));
                rejected++;
            }
        }

        return new MergeResult(new ArrayList<>(active.values()), added, superseded, supersededBy,
                duplicates, rejected);
    }

    /**
     * Returns whether a detection displaces an overlapping entity.
     */
    static boolean beats(Detection d, Entity e) {
        if (d.confidence() != e.confidence()) {
            return d.confidence() > e.confidence();
        }
        if (d.method() != e.method()) {
            return d.method() == DetectionMethod.CONTEXTUAL;
        }
        // a name that grew across chunks replaces its earlier, shorter span
        return d.label() == e.label() && widens(d, e);
    }

    private static boolean widens(Detection d, Entity e) {
        return d.start() <= e.start() && e.end() <= d.end() && d.end() - d.start() > e.length();
    }
}
