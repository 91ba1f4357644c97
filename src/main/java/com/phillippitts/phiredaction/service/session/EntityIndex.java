package com.phillippitts.phiredaction.service.session;

import com.phillippitts.phiredaction.domain.Entity;
import com.phillippitts.phiredaction.service.merge.MergeResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session registry of entities.
 *
 * <p>Active entities are pairwise non-overlapping and kept in insertion order. Superseded
 * entities stay in the history together with the id that displaced them. Ids are {@code e-<n>}
 * from a monotonic counter and are never reused, even after supersede.
 *
 * <p>Not thread-safe; the owning {@link RedactionSession} serializes access under its lock.
 */
public final class EntityIndex {

    /**
     * A displaced entity and the entity that displaced it.
     */
    public record SupersededEntry(Entity entity, String supersededBy) {}

    private final LinkedHashMap<String, Entity> active = new LinkedHashMap<>();
    private final LinkedHashMap<String, SupersededEntry> history = new LinkedHashMap<>();
    private long sequence = 0;

    /**
     * Issues the next entity id.
     */
    public String nextId() {
        return "e-" + (++sequence);
    }

    /**
     * Active entities in insertion order.
     */
    public List<Entity> active() {
        return new ArrayList<>(active.values());
    }

    /**
     * Active entities ordered by start offset.
     */
    public List<Entity> activeByStart() {
        List<Entity> out = active();
        out.sort(Comparator.comparingInt(Entity::start).thenComparing(Entity::id));
        return out;
    }

    /**
     * Active entities for listings: label precedence first, then confidence, then start offset.
     */
    public List<Entity> activeByPrecedence() {
        List<Entity> out = active();
        out.sort(Comparator.comparingInt((Entity e) -> e.label().precedence()).reversed()
                .thenComparing(Comparator.comparingDouble(Entity::confidence).reversed())
                .thenComparingInt(Entity::start));
        return out;
    }

    /**
     * Replaces the active set with a merge result and records superseded entities.
     */
    public void apply(MergeResult result) {
        active.clear();
        result.entities().forEach(e -> active.put(e.id(), e));
        for (Entity s : result.superseded()) {
            history.put(s.id(), new SupersededEntry(s, result.supersededBy().get(s.id())));
        }
    }

    public Optional<Entity> findActive(String id) {
        return Optional.ofNullable(active.get(id));
    }

    public Optional<SupersededEntry> findSuperseded(String id) {
        return Optional.ofNullable(history.get(id));
    }

    public Map<String, SupersededEntry> history() {
        return new LinkedHashMap<>(history);
    }

    public int activeCount() {
        return active.size();
    }
}
