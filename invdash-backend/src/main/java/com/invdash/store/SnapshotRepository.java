package com.invdash.store;

import com.invdash.model.ScopeName;
import com.invdash.model.SnapshotPayload;

import java.util.Optional;

/**
 * Durable write-behind copy of cached snapshots, keyed by provider, scope, hosts key and level.
 *
 * <p>Only used for best-effort persistence and cold-start hydration; the in-memory snapshot store
 * stays authoritative for serving.
 */
public interface SnapshotRepository {

    /**
     * Inserts or replaces the stored payload.
     *
     * @throws SnapshotPersistenceException if the write fails
     */
    void save(String provider, ScopeName scope, String hostsKey, String level, SnapshotPayload payload);

    /**
     * @return the stored payload, or empty if none was ever saved
     * @throws SnapshotPersistenceException if the read fails
     */
    Optional<SnapshotPayload> load(String provider, ScopeName scope, String hostsKey, String level);
}
