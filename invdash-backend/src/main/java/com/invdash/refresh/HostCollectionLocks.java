package com.invdash.refresh;

import com.invdash.model.ScopeKey;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per normalized host id, shared by every provider and scope, so overlapping jobs take
 * turns calling the same host.
 */
public class HostCollectionLocks {
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock forHost(String hostId) {
        String host = ScopeKey.normalizeHost(hostId);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host id is required");
        }
        return locks.computeIfAbsent(host, h -> new ReentrantLock());
    }

    public int size() {
        return locks.size();
    }
}
