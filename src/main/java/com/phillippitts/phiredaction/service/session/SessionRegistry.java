package com.phillippitts.phiredaction.service.session;

import com.phillippitts.phiredaction.config.properties.SessionProperties;
import com.phillippitts.phiredaction.exception.SessionNotFoundException;
import com.phillippitts.phiredaction.exception.SnapshotNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live sessions and of the snapshot ids they issued.
 *
 * <p>Sessions are independent; the registry itself is a pair of concurrent maps and holds no
 * lock across sessions.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final SessionProperties props;
    private final Clock clock;
    private final Map<String, RedactionSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> snapshotOwners = new ConcurrentHashMap<>();

    public SessionRegistry(SessionProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    /**
     * Returns the session, creating it on first use.
     */
    public RedactionSession getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            LOG.info("Session {} started", id);
            return new RedactionSession(id, props.getChunkSeparator(), clock.instant());
        });
    }

    /**
     * @throws SessionNotFoundException if no such session is live
     */
    public RedactionSession get(String sessionId) {
        RedactionSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public Optional<RedactionSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public void registerSnapshot(String snapshotId, String sessionId) {
        snapshotOwners.put(snapshotId, sessionId);
    }

    /**
     * Resolves the live session that issued a snapshot.
     *
     * @throws SnapshotNotFoundException if the snapshot is unknown or its session has ended
     */
    public RedactionSession sessionForSnapshot(String snapshotId) {
        String owner = snapshotOwners.get(snapshotId);
        RedactionSession session = owner == null ? null : sessions.get(owner);
        if (session == null) {
            throw new SnapshotNotFoundException(snapshotId);
        }
        return session;
    }

    /**
     * Ends a session, discarding its buffer, index and snapshots.
     *
     * @throws SessionNotFoundException if no such session is live
     */
    public void end(String sessionId) {
        RedactionSession removed = sessions.remove(sessionId);
        if (removed == null) {
            throw new SessionNotFoundException(sessionId);
        }
        snapshotOwners.values().removeIf(sessionId::equals);
        LOG.info("Session {} ended after {} s", sessionId,
                Duration.between(removed.createdAt(), clock.instant()).toSeconds());
    }

    public Collection<RedactionSession> all() {
        return List.copyOf(sessions.values());
    }

    public int activeCount() {
        return sessions.size();
    }

    /**
     * Ends sessions idle for longer than {@code phi.session.idle-timeout-minutes}.
     */
    @Scheduled(fixedDelayString = "${phi.session.sweep-interval-ms:60000}")
    public void sweepIdleSessions() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(props.getIdleTimeoutMinutes()));
        List<String> idle = new ArrayList<>();
        sessions.forEach((id, s) -> {
            if (s.lastActivity().isBefore(cutoff)) {
                idle.add(id);
            }
        });
        for (String id : idle) {
            if (sessions.remove(id) != null) {
                snapshotOwners.values().removeIf(id::equals);
                LOG.info("Session {} evicted after {} minutes idle", id, props.getIdleTimeoutMinutes());
            }
        }
    }
}
