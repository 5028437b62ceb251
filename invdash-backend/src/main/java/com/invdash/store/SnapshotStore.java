package com.invdash.store;

import com.invdash.model.InventoryRecord;
import com.invdash.model.ScopeKey;
import com.invdash.model.ScopeName;
import com.invdash.model.SnapshotData;
import com.invdash.model.SnapshotHostStatus;
import com.invdash.model.SnapshotPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Latest cached snapshot per {@link ScopeKey} for one provider.
 *
 * <p>The in-memory map is authoritative for serving. The {@link SnapshotRepository} is a
 * best-effort write-behind copy, read only to hydrate a scope that is not in memory yet.
 * Repository I/O never happens while the store lock is held.
 */
public class SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    public static final String MAX_AGE_EXCEEDED = "max_age_exceeded";

    private final Object lock = new Object();
    private final Map<ScopeKey, SnapshotPayload> snapshots = new HashMap<>();

    private final String provider;
    private final SnapshotRepository repository;
    private final Clock clock;
    private final Map<ScopeName, Duration> maxAges;
    private final int maxRetained;
    private final Duration retention;

    /**
     * Creates a snapshot store.
     *
     * @param provider provider whose snapshots this store holds; part of the durable key
     * @param repository durable store
     * @param clock time source
     * @param maxAges max age per scope type
     * @param maxRetained number of scopes kept before old entries are pruned
     * @param retention age after which an entry may be pruned
     */
    public SnapshotStore(
            String provider,
            SnapshotRepository repository,
            Clock clock,
            Map<ScopeName, Duration> maxAges,
            int maxRetained,
            Duration retention
    ) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxAges = new EnumMap<>(ScopeName.class);
        for (ScopeName scope : ScopeName.values()) {
            Duration maxAge = maxAges == null ? null : maxAges.get(scope);
            if (maxAge == null || maxAge.isNegative()) {
                throw new IllegalArgumentException("max age missing for scope " + scope.getValue());
            }
            this.maxAges.put(scope, maxAge);
        }
        this.maxRetained = maxRetained;
        this.retention = Objects.requireNonNull(retention, "retention");
    }

    public Duration maxAge(ScopeName scope) {
        return maxAges.get(scope);
    }

    /**
     * Returns a copy of the cached payload, hydrating it from the durable store on a miss.
     *
     * <p>A copy older than the scope's max age is annotated {@code stale} with reason
     * {@value #MAX_AGE_EXCEEDED}; the cached entry itself is left as is.
     *
     * @param key scope key
     * @return snapshot copy, or empty if this scope was never populated
     */
    public Optional<SnapshotPayload> getSnapshot(ScopeKey key) {
        Optional<SnapshotPayload> found = find(key);
        found.ifPresent(snapshot -> {
            if (!snapshot.isStale() && isExpired(snapshot, maxAge(key.getScope()), clock.instant())) {
                snapshot.setStale(true);
                snapshot.setStaleReason(MAX_AGE_EXCEEDED);
            }
        });
        return found;
    }

    public boolean isFresh(ScopeKey key) {
        return isFresh(key, maxAge(key.getScope()));
    }

    /**
     * @return true iff a snapshot exists, is not marked stale, and is no older than {@code maxAge}
     */
    public boolean isFresh(ScopeKey key, Duration maxAge) {
        return find(key)
                .map(snapshot -> !snapshot.isStale() && !isExpired(snapshot, maxAge, clock.instant()))
                .orElse(false);
    }

    /**
     * Makes sure the scope has a cached entry: hydrates it from the durable store, or creates an
     * empty one with every host pending.
     */
    public SnapshotPayload initSnapshot(ScopeKey key) {
        Optional<SnapshotPayload> existing = find(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        synchronized (lock) {
            SnapshotPayload snapshot = snapshots.computeIfAbsent(key, k -> SnapshotPayload.empty(k, clock.instant()));
            return withSource(snapshot.copy(), SnapshotPayload.SOURCE_MEMORY);
        }
    }

    /**
     * Merges one host's outcome into the scope's snapshot.
     *
     * <p>The host is matched on its normalized id. Non-null {@code data} replaces every record of
     * that host (last write wins); {@code null} keeps the records already cached. The host status
     * is overwritten and {@code summary}/{@code total_hosts} are recomputed.
     *
     * @param key scope key
     * @param hostId host id as supplied by the caller
     * @param data new records, or {@code null} to keep the cached ones
     * @param status new host status
     * @return copy of the updated snapshot
     */
    public SnapshotPayload upsertHost(ScopeKey key, String hostId, List<InventoryRecord> data, SnapshotHostStatus status) {
        Objects.requireNonNull(status, "status");
        String host = ScopeKey.normalizeHost(hostId);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host id is required");
        }
        Instant now = clock.instant();
        synchronized (lock) {
            pruneLocked(now, key);
            SnapshotPayload snapshot = snapshots.computeIfAbsent(key, k -> SnapshotPayload.empty(k, now));
            if (data != null) {
                if (snapshot.getData() == null) {
                    snapshot.setData(SnapshotData.empty(key.getScope()));
                }
                snapshot.getData().replace(hostId, data);
            }
            snapshot.getHostsStatus().put(host, status.copy());
            snapshot.recomputeCounters();
            snapshot.setGeneratedAt(now);
            return withSource(snapshot.copy(), SnapshotPayload.SOURCE_MEMORY);
        }
    }

    /**
     * Cached records of one host, if any were ever collected.
     */
    public Optional<List<InventoryRecord>> getHostData(ScopeKey key, String hostId) {
        synchronized (lock) {
            SnapshotPayload snapshot = snapshots.get(key);
            if (snapshot == null || snapshot.getData() == null) {
                return Optional.empty();
            }
            return snapshot.getData().recordsFor(hostId);
        }
    }

    /**
     * Flags the snapshot stale without discarding its data.
     *
     * @return updated copy, or empty if the scope has no snapshot
     */
    public Optional<SnapshotPayload> markStale(ScopeKey key, String reason) {
        synchronized (lock) {
            SnapshotPayload snapshot = snapshots.get(key);
            if (snapshot == null) {
                log.warn("Cannot mark missing snapshot stale: provider={}, scope_key={}", provider, key.asString());
                return Optional.empty();
            }
            snapshot.setStale(true);
            snapshot.setStaleReason(reason);
            log.warn("Snapshot marked stale: provider={}, scope_key={}, reason={}", provider, key.asString(), reason);
            return Optional.of(withSource(snapshot.copy(), SnapshotPayload.SOURCE_MEMORY));
        }
    }

    /**
     * Clears the stale flag. Data is untouched.
     *
     * @return updated copy, or empty if the scope has no snapshot
     */
    public Optional<SnapshotPayload> clearStale(ScopeKey key) {
        synchronized (lock) {
            SnapshotPayload snapshot = snapshots.get(key);
            if (snapshot == null) {
                return Optional.empty();
            }
            snapshot.setStale(false);
            snapshot.setStaleReason(null);
            return Optional.of(withSource(snapshot.copy(), SnapshotPayload.SOURCE_MEMORY));
        }
    }

    /**
     * Stamps {@code expires_at} after a successful refresh.
     *
     * @return updated copy, or empty if the scope has no snapshot
     */
    public Optional<SnapshotPayload> markRefreshed(ScopeKey key, Instant expiresAt) {
        synchronized (lock) {
            SnapshotPayload snapshot = snapshots.get(key);
            if (snapshot == null) {
                return Optional.empty();
            }
            snapshot.setExpiresAt(expiresAt);
            return Optional.of(withSource(snapshot.copy(), SnapshotPayload.SOURCE_MEMORY));
        }
    }

    /**
     * Writes the in-memory payload to the durable store. Failures are logged and swallowed: the
     * in-memory copy stays authoritative.
     *
     * @return the payload that was written, or empty if there was nothing to write or the write failed
     */
    public Optional<SnapshotPayload> persist(ScopeKey key) {
        SnapshotPayload payload;
        synchronized (lock) {
            SnapshotPayload snapshot = snapshots.get(key);
            if (snapshot == null) {
                return Optional.empty();
            }
            payload = snapshot.copy();
        }
        try {
            repository.save(provider, key.getScope(), key.hostsKey(), key.getLevel(), payload);
            log.debug("Persisted snapshot: provider={}, scope_key={}", provider, key.asString());
            return Optional.of(payload);
        } catch (RuntimeException e) {
            log.error("Failed to persist snapshot: provider={}, scope_key={}", provider, key.asString(), e);
            return Optional.empty();
        }
    }

    public int size() {
        synchronized (lock) {
            return snapshots.size();
        }
    }

    private Optional<SnapshotPayload> find(ScopeKey key) {
        Objects.requireNonNull(key, "key");
        synchronized (lock) {
            SnapshotPayload snapshot = snapshots.get(key);
            if (snapshot != null) {
                return Optional.of(withSource(snapshot.copy(), SnapshotPayload.SOURCE_MEMORY));
            }
        }
        return hydrate(key);
    }

    private Optional<SnapshotPayload> hydrate(ScopeKey key) {
        Optional<SnapshotPayload> loaded;
        try {
            loaded = repository.load(provider, key.getScope(), key.hostsKey(), key.getLevel());
        } catch (RuntimeException e) {
            log.error("Failed to load snapshot from durable store: provider={}, scope_key={}", provider, key.asString(), e);
            return Optional.empty();
        }
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        synchronized (lock) {
            SnapshotPayload existing = snapshots.get(key);
            if (existing != null) {
                return Optional.of(withSource(existing.copy(), SnapshotPayload.SOURCE_MEMORY));
            }
            SnapshotPayload payload = loaded.get();
            normalizeLoaded(key, payload);
            pruneLocked(clock.instant(), key);
            snapshots.put(key, payload);
            log.info("Hydrated snapshot from durable store: provider={}, scope_key={}, generated_at={}",
                    provider, key.asString(), payload.getGeneratedAt());
            return Optional.of(withSource(payload.copy(), SnapshotPayload.SOURCE_DB));
        }
    }

    private static void normalizeLoaded(ScopeKey key, SnapshotPayload payload) {
        payload.setScope(key.getScope());
        payload.setHosts(new ArrayList<>(key.getHosts()));
        payload.setLevel(key.getLevel());
        if (payload.getHostsStatus() == null) {
            payload.setHostsStatus(new LinkedHashMap<>());
        }
        if (payload.getData() == null) {
            payload.setData(SnapshotData.empty(key.getScope()));
        }
        if (payload.getGeneratedAt() == null) {
            payload.setGeneratedAt(Instant.EPOCH);
        }
        payload.recomputeCounters();
    }

    private static boolean isExpired(SnapshotPayload snapshot, Duration maxAge, Instant now) {
        if (snapshot.getExpiresAt() != null && now.isAfter(snapshot.getExpiresAt())) {
            return true;
        }
        return snapshot.getGeneratedAt() == null
                || Duration.between(snapshot.getGeneratedAt(), now).compareTo(maxAge) > 0;
    }

    private static SnapshotPayload withSource(SnapshotPayload copy, String source) {
        copy.setSource(source);
        return copy;
    }

    /**
     * Drops entries older than the retention window once the store is full. {@code writing} is the
     * scope about to be written and is never dropped, however old it is.
     */
    private void pruneLocked(Instant now, ScopeKey writing) {
        if (snapshots.size() < maxRetained) {
            return;
        }
        Instant cutoff = now.minus(retention);
        int before = snapshots.size();
        snapshots.entrySet().removeIf(e -> !e.getKey().equals(writing)
                && (e.getValue().getGeneratedAt() == null || e.getValue().getGeneratedAt().isBefore(cutoff)));
        if (snapshots.size() < before) {
            log.debug("Pruned {} snapshots: provider={}", before - snapshots.size(), provider);
        }
    }
}
