package com.invdash.refresh;

import com.invdash.collector.CollectorRegistry;
import com.invdash.collector.InventoryCollector;
import com.invdash.config.InventoryProperties;
import com.invdash.model.JobStatus;
import com.invdash.model.ScopeKey;
import com.invdash.model.ScopeName;
import com.invdash.model.SnapshotPayload;
import com.invdash.store.HostHealthStore;
import com.invdash.store.JobNotFoundException;
import com.invdash.store.JobStore;
import com.invdash.store.SnapshotRepository;
import com.invdash.store.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Entry point for inventory reads and refreshes, partitioned by provider.
 *
 * <p>Each registered collector gets its own {@link RefreshOrchestrator}, {@link JobStore} and
 * {@link SnapshotStore}; host health, host collection locks and thread pools are shared.
 */
@Slf4j
@Service
public class InventoryService {
    private final Map<String, RefreshOrchestrator> orchestrators;

    public InventoryService(
            CollectorRegistry collectorRegistry,
            HostHealthStore hostHealthStore,
            HostCollectionLocks hostCollectionLocks,
            SnapshotRepository snapshotRepository,
            RefreshExecutors refreshExecutors,
            RefreshSettings refreshSettings,
            InventoryProperties properties,
            Clock clock
    ) {
        InventoryProperties.RefreshProperties refresh = properties.getRefresh();
        InventoryProperties.JobProperties jobs = properties.getJobs();
        Map<ScopeName, Duration> maxAges = new EnumMap<>(ScopeName.class);
        maxAges.put(ScopeName.VMS, refresh.getVmsMaxAge());
        maxAges.put(ScopeName.HOSTS, refresh.getHostsMaxAge());

        Map<String, RefreshOrchestrator> byProvider = new TreeMap<>();
        for (String provider : collectorRegistry.providers()) {
            InventoryCollector collector = collectorRegistry.find(provider).orElseThrow();
            JobStore jobStore = new JobStore(clock, jobs.getMaxRetained(), jobs.getRetention());
            SnapshotStore snapshotStore = new SnapshotStore(provider, snapshotRepository, clock, maxAges,
                    refresh.getMaxRetainedSnapshots(), refresh.getSnapshotRetention());
            byProvider.put(provider, new RefreshOrchestrator(collector, jobStore, snapshotStore, hostHealthStore,
                    hostCollectionLocks, refreshExecutors, refreshSettings, clock));
        }
        this.orchestrators = Collections.unmodifiableMap(byProvider);
        log.info("Inventory providers ready: {}", byProvider.keySet());
    }

    /**
     * Serves the scope from cache, refreshing it first when it is not fresh or {@code force} is set.
     *
     * @throws ProviderNotFoundException if no collector handles {@code provider}
     * @throws IllegalArgumentException if the scope is unknown or no host is given
     * @throws InventoryUnavailableException if the scope could not be collected and nothing is cached
     */
    public SnapshotPayload getOrRefresh(String provider, String scope, List<String> hosts, String level, boolean force) {
        ScopeKey key = scopeKey(scope, hosts, level);
        return orchestrator(provider).getOrRefresh(key, force);
    }

    /**
     * Starts a background refresh.
     *
     * @return the job to poll, or empty when the cached snapshot is still fresh
     */
    public Optional<JobStatus> triggerRefresh(String provider, String scope, List<String> hosts, String level, boolean force) {
        ScopeKey key = scopeKey(scope, hosts, level);
        return orchestrator(provider).triggerRefresh(key, force);
    }

    public JobStatus getJobStatus(String provider, String jobId) {
        return orchestrator(provider).getJobStatus(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public boolean isRefreshing(String provider, ScopeKey key) {
        return orchestrator(provider).isRefreshing(key);
    }

    public Set<String> providers() {
        return orchestrators.keySet();
    }

    /**
     * Builds a normalized scope key from request parameters.
     */
    public static ScopeKey scopeKey(String scope, List<String> hosts, String level) {
        ScopeKey key = ScopeKey.of(ScopeName.parse(scope), hosts, level);
        if (key.getHosts().isEmpty()) {
            throw new IllegalArgumentException("at least one host is required");
        }
        return key;
    }

    private RefreshOrchestrator orchestrator(String provider) {
        RefreshOrchestrator orchestrator = orchestrators.get(CollectorRegistry.normalizeProvider(provider));
        if (orchestrator == null) {
            throw new ProviderNotFoundException(provider);
        }
        return orchestrator;
    }
}
