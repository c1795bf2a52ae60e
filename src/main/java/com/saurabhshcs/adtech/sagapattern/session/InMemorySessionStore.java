package com.saurabhshcs.adtech.sagapattern.session;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of SessionStore.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Single-instance deployments
 * </p>
 * <p>
 * Note: sessions are lost on application restart. Expiration is checked on every lookup
 * and swept by {@link #purgeExpired()}.
 * </p>
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Entry> store = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final Clock clock;

    public InMemorySessionStore(Duration timeout, Clock clock) {
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public UserSession create() {
        Instant now = clock.instant();
        UserSession session = new UserSession(SessionIds.newId(), now);
        store.put(session.getSessionId(), new Entry(session, now));
        log.debug("Created session {}", session.getSessionId());
        return session;
    }

    @Override
    public Optional<UserSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Entry entry = store.computeIfPresent(sessionId,
                (id, current) -> isExpired(current, now) ? null : new Entry(current.session(), now));
        return Optional.ofNullable(entry).map(Entry::session);
    }

    @Override
    public void save(UserSession session) {
        store.put(session.getSessionId(), new Entry(session, clock.instant()));
    }

    @Override
    public boolean reset(String sessionId) {
        Optional<UserSession> session = get(sessionId);
        session.ifPresent(s -> {
            s.resetData();
            save(s);
        });
        return session.isPresent();
    }

    @Override
    public boolean delete(String sessionId) {
        return sessionId != null && store.remove(sessionId) != null;
    }

    /**
     * Drops every session idle for longer than the timeout.
     *
     * @return number of sessions removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = store.size();
        store.values().removeIf(entry -> isExpired(entry, now));
        int removed = before - store.size();
        if (removed > 0) {
            log.info("Purged {} expired sessions", removed);
        }
        return removed;
    }

    /**
     * Returns the current number of stored sessions, expired ones included until purged.
     */
    public int size() {
        return store.size();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return entry.lastAccess().plus(timeout).isBefore(now);
    }

    private record Entry(UserSession session, Instant lastAccess) {
    }
}
