package com.invdash.store;

import com.invdash.model.ScopeName;
import com.invdash.model.SnapshotPayload;

import java.util.Optional;

/**
 * Used when persistence is disabled: nothing is written and nothing is ever found.
 */
public class NoopSnapshotRepository implements SnapshotRepository {

    @Override
    public void save(String provider, ScopeName scope, String hostsKey, String level, SnapshotPayload payload) {
    }

    @Override
    public Optional<SnapshotPayload> load(String provider, ScopeName scope, String hostsKey, String level) {
        return Optional.empty();
    }
}
