package com.saurabhshcs.adtech.sagapattern.session;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically discards idle in-memory sessions. Redis expires keys on its own.
 */
@RequiredArgsConstructor
public class ExpiredSessionReaper {

    private final InMemorySessionStore store;

    @Scheduled(fixedDelayString = "${saga.session.reap-interval:PT5M}")
    public void reap() {
        store.purgeExpired();
    }
}
