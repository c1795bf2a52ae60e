package com.saurabhshcs.adtech.sagapattern.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed session store.
 *
 * One record per session, key {@code session:{sessionId}}, value produced by
 * {@link SessionCodec}. Every read and write re-arms the TTL, so Redis enforces the
 * sliding expiration.
 */
@Slf4j
public class RedisSessionStore implements SessionStore {

    private static final String KEY_PREFIX = "session:";

    private final StringRedisTemplate redisTemplate;
    private final SessionCodec codec;
    private final Duration timeout;
    private final Clock clock;

    public RedisSessionStore(StringRedisTemplate redisTemplate, SessionCodec codec, Duration timeout, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public UserSession create() {
        UserSession session = new UserSession(SessionIds.newId(), clock.instant());
        save(session);
        log.debug("Created session {}", session.getSessionId());
        return session;
    }

    @Override
    public Optional<UserSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        String key = buildKey(sessionId);
        String json = redisTemplate.opsForValue().getAndExpire(key, timeout);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(json));
        } catch (SessionCodecException e) {
            log.warn("Discarding corrupt session record {}: {}", key, e.getMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @Override
    public void save(UserSession session) {
        redisTemplate.opsForValue().set(buildKey(session.getSessionId()), codec.encode(session), timeout);
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
        return sessionId != null && Boolean.TRUE.equals(redisTemplate.delete(buildKey(sessionId)));
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
