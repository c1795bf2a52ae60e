package com.saurabhshcs.adtech.sagapattern.session;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-session mutual exclusion. Work on different sessions never contends; a lock entry
 * lives only while some thread holds or waits for it.
 */
public class SessionLockRegistry {

    private final Map<String, Holder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        Holder holder = locks.compute(sessionId, (id, current) -> {
            Holder h = current != null ? current : new Holder();
            h.users++;
            return h;
        });
        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(sessionId, (id, h) -> --h.users == 0 ? null : h);
        }
    }

    int activeLocks() {
        return locks.size();
    }

    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
