package org.example.coach.service.conversation;

import org.example.coach.config.CoachProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory session registry keyed by user id. Sessions are created on first event and
 * evicted once idle longer than {@code coach.session.idle-timeout}.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<Long, SessionState> sessions = new ConcurrentHashMap<>();
    private final CoachProperties properties;
    private final Clock clock;

    public SessionStore(CoachProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public SessionState getOrCreate(long userId) {
        SessionState existing = sessions.get(userId);
        if (existing != null) {
            return existing;
        }
        if (sessions.size() >= properties.getSession().getMaxSessions()) {
            int evicted = evictIdle();
            log.warn("Session store at capacity ({}); evicted {} idle sessions", sessions.size(), evicted);
        }
        return sessions.computeIfAbsent(userId, id -> new SessionState(id, clock.instant()));
    }

    public Optional<SessionState> find(long userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    /**
     * Removes sessions idle past the timeout. Sessions currently handling an event are kept.
     *
     * @return number of sessions removed
     */
    public int evictIdle() {
        Duration idleTimeout = properties.getSession().getIdleTimeout();
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        Iterator<Map.Entry<Long, SessionState>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            SessionState session = it.next().getValue();
            if (!session.getLastSeen().isBefore(cutoff)) {
                continue;
            }
            if (!session.lock().tryLock()) {
                continue;
            }
            try {
                it.remove();
                evicted++;
            } finally {
                session.lock().unlock();
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle conversation sessions", evicted);
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }
}
