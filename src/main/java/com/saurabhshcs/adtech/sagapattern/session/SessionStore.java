package com.saurabhshcs.adtech.sagapattern.session;

import java.util.Optional;

/**
 * Owns every {@link UserSession} and its sliding expiration.
 * <p>
 * Implementations:
 * - In-Memory (tests, single instance)
 * - Redis (sessions survive restarts and are shared between instances)
 * </p>
 * Unknown, expired and corrupt sessions are reported as absent, never as errors.
 */
public interface SessionStore {

    /**
     * Allocate a new session with a fresh unguessable id and seeded resources.
     */
    UserSession create();

    /**
     * Look up a live session. A successful lookup refreshes its last-access time.
     *
     * @param sessionId the session identifier, may be null
     * @return the session, or empty when unknown or expired
     */
    Optional<UserSession> get(String sessionId);

    /**
     * Persist the current state of the session and refresh its expiration.
     */
    void save(UserSession session);

    /**
     * Restore seed data for the session, keeping its id and timestamps.
     *
     * @return false when the session does not exist
     */
    boolean reset(String sessionId);

    /**
     * Remove the session entirely.
     *
     * @return true when something was removed
     */
    boolean delete(String sessionId);

    /**
     * Entry point used by request handling: resolve the given session or start a new one.
     */
    default UserSession getOrCreate(String sessionId) {
        if (sessionId != null && !sessionId.isBlank()) {
            Optional<UserSession> existing = get(sessionId);
            if (existing.isPresent()) {
                return existing.get();
            }
        }
        return create();
    }
}
