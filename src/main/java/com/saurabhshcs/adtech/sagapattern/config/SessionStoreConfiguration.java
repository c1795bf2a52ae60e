package com.saurabhshcs.adtech.sagapattern.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.saurabhshcs.adtech.sagapattern.session.ExpiredSessionReaper;
import com.saurabhshcs.adtech.sagapattern.session.InMemorySessionStore;
import com.saurabhshcs.adtech.sagapattern.session.RedisSessionStore;
import com.saurabhshcs.adtech.sagapattern.session.SessionCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Chooses the session backend from {@code saga.session.store}.
 */
@Slf4j
@Configuration
public class SessionStoreConfiguration {

    @Bean
    public SessionCodec sessionCodec(ObjectMapper objectMapper) {
        return new SessionCodec(objectMapper);
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(name = "saga.session.store", havingValue = "memory", matchIfMissing = true)
    static class InMemory {

        @Bean
        public InMemorySessionStore inMemorySessionStore(SagaProperties properties, Clock clock) {
            log.info("Using in-memory session store, timeout {}", properties.getSession().getTimeout());
            return new InMemorySessionStore(properties.getSession().getTimeout(), clock);
        }

        @Bean
        public ExpiredSessionReaper expiredSessionReaper(InMemorySessionStore store) {
            return new ExpiredSessionReaper(store);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "saga.session.store", havingValue = "redis")
    static class Redis {

        @Bean
        public RedisSessionStore redisSessionStore(StringRedisTemplate redisTemplate, SessionCodec codec,
                                                   SagaProperties properties, Clock clock) {
            log.info("Using Redis session store, timeout {}", properties.getSession().getTimeout());
            return new RedisSessionStore(redisTemplate, codec, properties.getSession().getTimeout(), clock);
        }
    }
}
