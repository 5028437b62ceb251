package com.invdash.refresh;

import com.invdash.collector.CollectorContext;
import com.invdash.collector.CollectorRegistry;
import com.invdash.collector.InventoryCollector;
import com.invdash.model.HostHealthRecord;
import com.invdash.model.HostJobState;
import com.invdash.model.HostJobStatus;
import com.invdash.model.InventoryRecord;
import com.invdash.model.JobStatus;
import com.invdash.model.ScopeKey;
import com.invdash.model.SnapshotHostState;
import com.invdash.model.SnapshotHostStatus;
import com.invdash.model.SnapshotPayload;
import com.invdash.store.HostHealthStore;
import com.invdash.store.HostTransitionException;
import com.invdash.store.JobNotFoundException;
import com.invdash.store.JobStore;
import com.invdash.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives refreshes of one provider's snapshots.
 *
 * <p>For a scope key it either serves the cached snapshot or runs a refresh job: one unit of work
 * per host on the shared host pool, skipping hosts in cooldown, feeding every outcome back into
 * {@link HostHealthStore}, {@link JobStore} and {@link SnapshotStore}. At most one refresh runs per
 * scope key; concurrent callers join it.
 */
public class RefreshOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RefreshOrchestrator.class);

    public static final String ALL_HOSTS_FAILED = "all hosts failed";
    public static final String PARTIAL = "partial";
    public static final String JOB_MAX_DURATION_REACHED = "job_max_duration_reached";

    private static final String ERROR_TYPE_TIMEOUT = "timeout";

    private final String provider;
    private final InventoryCollector collector;
    private final JobStore jobStore;
    private final SnapshotStore snapshotStore;
    private final HostHealthStore hostHealth;
    private final HostCollectionLocks hostLocks;
    private final RefreshExecutors executors;
    private final RefreshSettings settings;
    private final Clock clock;

    private final ConcurrentHashMap<ScopeKey, InFlightRefresh> inFlight = new ConcurrentHashMap<>();

    public RefreshOrchestrator(
            InventoryCollector collector,
            JobStore jobStore,
            SnapshotStore snapshotStore,
            HostHealthStore hostHealth,
            HostCollectionLocks hostLocks,
            RefreshExecutors executors,
            RefreshSettings settings,
            Clock clock
    ) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.provider = CollectorRegistry.normalizeProvider(collector.provider());
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore");
        this.hostHealth = Objects.requireNonNull(hostHealth, "hostHealth");
        this.hostLocks = Objects.requireNonNull(hostLocks, "hostLocks");
        this.executors = Objects.requireNonNull(executors, "executors");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the cached snapshot when it is fresh, otherwise refreshes the scope and waits for it.
     *
     * @param key scope key
     * @param force refresh even if the cached snapshot is fresh
     * @return snapshot copy; stale-flagged when every host of the refresh failed
     * @throws InventoryUnavailableException when every host failed and nothing was ever cached
     */
    public SnapshotPayload getOrRefresh(ScopeKey key, boolean force) {
        if (!force && snapshotStore.isFresh(key)) {
            Optional<SnapshotPayload> cached = snapshotStore.getSnapshot(key);
            if (cached.isPresent()) {
                log.debug("Serving cached snapshot: provider={}, scope_key={}", provider, key.asString());
                return cached.get();
            }
        }

        InFlightRefresh refresh = startOrJoin(key);
        RefreshOutcome outcome = await(refresh);
        SnapshotPayload snapshot = outcome.getSnapshot();
        if (outcome.isAllFailed() && !snapshot.isEverRefreshed()) {
            throw new InventoryUnavailableException(provider, key, refresh.getJobId());
        }
        return snapshot;
    }

    /**
     * Starts (or joins) a refresh in the background.
     *
     * @return the job to poll, or empty when the cached snapshot is fresh and {@code force} is off
     */
    public Optional<JobStatus> triggerRefresh(ScopeKey key, boolean force) {
        if (!force && snapshotStore.isFresh(key)) {
            log.debug("Refresh not needed: provider={}, scope_key={}", provider, key.asString());
            return Optional.empty();
        }
        InFlightRefresh refresh = startOrJoin(key);
        return Optional.of(jobStore.getJob(refresh.getJobId()).orElse(refresh.getJob()));
    }

    public Optional<JobStatus> getJobStatus(String jobId) {
        return jobStore.getJob(jobId);
    }

    /**
     * @return true while a job for this scope is pending or running
     */
    public boolean isRefreshing(ScopeKey key) {
        return inFlight.containsKey(key) || jobStore.getActiveForScope(key).isPresent();
    }

    private InFlightRefresh startOrJoin(ScopeKey key) {
        AtomicBoolean created = new AtomicBoolean();
        InFlightRefresh refresh = inFlight.computeIfAbsent(key, k -> {
            created.set(true);
            return new InFlightRefresh(jobStore.createJob(k));
        });
        if (!created.get()) {
            log.info("Joining in-flight refresh: provider={}, scope_key={}, job_id={}",
                    provider, key.asString(), refresh.getJobId());
            return refresh;
        }

        try {
            CompletableFuture
                    .supplyAsync(() -> runJob(key, refresh.getJobId()), executors.jobs())
                    .whenComplete((outcome, error) -> {
                        inFlight.remove(key, refresh);
                        if (error != null) {
                            refresh.getResult().completeExceptionally(error);
                        } else {
                            refresh.getResult().complete(outcome);
                        }
                    });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, refresh);
            log.error("Refresh rejected: provider={}, scope_key={}, job_id={}", provider, key.asString(), refresh.getJobId(), e);
            refresh.getResult().completeExceptionally(e);
        }
        return refresh;
    }

    private RefreshOutcome await(InFlightRefresh refresh) {
        try {
            return refresh.getResult().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Refresh failed: job_id=" + refresh.getJobId(), cause);
        }
    }

    private RefreshOutcome runJob(ScopeKey key, String jobId) {
        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(settings.getJobMaxDuration());
        log.info("Refresh started: provider={}, scope_key={}, job_id={}, hosts={}",
                provider, key.asString(), jobId, key.getHosts().size());
        try {
            snapshotStore.initSnapshot(key);
            jobStore.startJob(jobId);

            Tally tally = new Tally();
            List<HostTask> tasks = new ArrayList<>();
            for (String host : key.getHosts()) {
                if (hostHealth.isCoolingDown(host)) {
                    skipHost(key, jobId, host);
                    tally.skipped.incrementAndGet();
                    continue;
                }
                HostTask task = new HostTask(host);
                task.future = executors.hosts().submit(() -> collectHost(key, jobId, task, deadline, tally));
                tasks.add(task);
            }
            jobStore.heartbeat(jobId);

            boolean deadlineReached = awaitHosts(key, jobId, tasks, deadline, tally);
            return finalizeJob(key, jobId, tally, deadlineReached);
        } catch (RuntimeException e) {
            log.error("Refresh aborted: provider={}, scope_key={}, job_id={}", provider, key.asString(), jobId, e);
            throw e;
        }
    }

    /**
     * Waits for every host task until the job deadline; hosts still unfinished then are marked
     * {@code timeout}.
     *
     * @return true if the deadline cut the job short
     */
    private boolean awaitHosts(ScopeKey key, String jobId, List<HostTask> tasks, Instant deadline, Tally tally) {
        boolean deadlineReached = false;
        for (HostTask task : tasks) {
            if (!deadlineReached) {
                long remainingMs = Math.max(0L, Duration.between(clock.instant(), deadline).toMillis());
                try {
                    task.future.get(remainingMs, TimeUnit.MILLISECONDS);
                    continue;
                } catch (TimeoutException e) {
                    deadlineReached = true;
                } catch (ExecutionException e) {
                    log.error("Host worker failed: provider={}, job_id={}, host={}", provider, jobId, task.host, e.getCause());
                    if (task.claim()) {
                        failHost(key, jobId, task.host, HostJobState.ERROR, errorType(e.getCause()), errorMessage(e.getCause()), true);
                        tally.failed.incrementAndGet();
                    }
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    deadlineReached = true;
                }
            }
            if (task.claim()) {
                task.future.cancel(true);
                log.warn("Host abandoned at job deadline: provider={}, job_id={}, host={}", provider, jobId, task.host);
                failHost(key, jobId, task.host, HostJobState.TIMEOUT, JOB_MAX_DURATION_REACHED, JOB_MAX_DURATION_REACHED, false);
                tally.failed.incrementAndGet();
            }
        }
        return deadlineReached;
    }

    private void collectHost(ScopeKey key, String jobId, HostTask task, Instant jobDeadline, Tally tally) {
        if (task.isClaimed()) {
            return;
        }
        ReentrantLock hostLock = hostLocks.forHost(task.host);
        try {
            hostLock.lockInterruptibly();
        } catch (InterruptedException e) {
            // the job deadline claimed this host while it waited for another job
            Thread.currentThread().interrupt();
            return;
        }
        try {
            if (!task.isClaimed()) {
                collectHostLocked(key, jobId, task, jobDeadline, tally);
            }
        } finally {
            hostLock.unlock();
        }
    }

    private void collectHostLocked(ScopeKey key, String jobId, HostTask task, Instant jobDeadline, Tally tally) {
        String host = task.host;
        JobStatus job;
        try {
            job = jobStore.markHost(jobId, host, HostJobState.RUNNING);
        } catch (HostTransitionException e) {
            log.debug("Host already settled before start: job_id={}, host={}", jobId, host);
            return;
        }
        HostJobStatus hostStatus = job.getHostsStatus().get(host);
        Instant hostDeadline = clock.instant().plus(settings.getHostTimeout());
        CollectorContext context = CollectorContext.builder()
                .provider(provider)
                .scope(key.getScope())
                .jobId(jobId)
                .attempt(hostStatus == null ? 1 : hostStatus.getAttempt())
                .deadline(hostDeadline.isBefore(jobDeadline) ? hostDeadline : jobDeadline)
                .build();

        Future<List<InventoryRecord>> call = executors.calls().submit(() -> collector.collect(host, key.getLevel(), context));
        try {
            List<InventoryRecord> records = call.get(settings.getHostTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (task.claim()) {
                succeedHost(key, jobId, host, sanitize(host, records));
                tally.ok.incrementAndGet();
            }
        } catch (TimeoutException e) {
            call.cancel(true);
            if (task.claim()) {
                String message = "host collection exceeded " + settings.getHostTimeout().toSeconds() + "s";
                log.warn("Host collection timed out: provider={}, job_id={}, host={}, timeout={}",
                        provider, jobId, host, settings.getHostTimeout());
                failHost(key, jobId, host, HostJobState.TIMEOUT, ERROR_TYPE_TIMEOUT, message, true);
                tally.failed.incrementAndGet();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (task.claim()) {
                log.warn("Host collection failed: provider={}, job_id={}, host={}, error={}",
                        provider, jobId, host, errorMessage(cause));
                failHost(key, jobId, host, HostJobState.ERROR, errorType(cause), errorMessage(cause), true);
                tally.failed.incrementAndGet();
            }
        } catch (InterruptedException e) {
            // the job deadline claimed this host
            call.cancel(true);
            Thread.currentThread().interrupt();
        }
    }

    private void succeedHost(ScopeKey key, String jobId, String host, List<InventoryRecord> records) {
        HostHealthRecord health = hostHealth.recordSuccess(host);
        SnapshotHostStatus status = SnapshotHostStatus.builder()
                .state(SnapshotHostState.OK)
                .lastSuccessAt(health.getLastSuccessAt())
                .lastErrorAt(health.getLastErrorAt())
                .lastJobId(jobId)
                .build();
        snapshotStore.upsertHost(key, host, records, status);
        jobStore.markHost(jobId, host, HostJobState.OK);
        log.debug("Host collected: provider={}, job_id={}, host={}, records={}", provider, jobId, host, records.size());
    }

    private void failHost(ScopeKey key, String jobId, String host, HostJobState state,
                          String errorType, String message, boolean countsAgainstHost) {
        HostHealthRecord health = countsAgainstHost
                ? hostHealth.recordFailure(host, errorType, message)
                : hostHealth.get(host);
        SnapshotHostState cacheState = SnapshotHostState.TIMEOUT;
        if (state != HostJobState.TIMEOUT) {
            cacheState = health.getLastSuccessAt() != null && isOutdated(key, health.getLastSuccessAt())
                    ? SnapshotHostState.STALE
                    : SnapshotHostState.ERROR;
        }
        SnapshotHostStatus status = SnapshotHostStatus.builder()
                .state(cacheState)
                .lastSuccessAt(health.getLastSuccessAt())
                .lastErrorAt(clock.instant())
                .cooldownUntil(health.getCooldownUntil())
                .lastJobId(jobId)
                .lastErrorType(errorType)
                .lastErrorMessage(message)
                .build();
        snapshotStore.upsertHost(key, host, null, status);
        try {
            jobStore.markHost(jobId, host, state, message, health.getCooldownUntil());
        } catch (HostTransitionException e) {
            log.warn("Ignoring late host update: job_id={}, host={}, reason={}", jobId, host, e.getMessage());
        }
    }

    private void skipHost(ScopeKey key, String jobId, String host) {
        HostHealthRecord health = hostHealth.get(host);
        boolean outdated = health.getLastSuccessAt() == null || isOutdated(key, health.getLastSuccessAt());
        SnapshotHostStatus status = SnapshotHostStatus.builder()
                .state(outdated ? SnapshotHostState.STALE : SnapshotHostState.SKIPPED_COOLDOWN)
                .lastSuccessAt(health.getLastSuccessAt())
                .lastErrorAt(health.getLastErrorAt())
                .cooldownUntil(health.getCooldownUntil())
                .lastJobId(jobId)
                .lastErrorType(health.getLastErrorType())
                .lastErrorMessage(health.getLastErrorMessage())
                .build();
        snapshotStore.upsertHost(key, host, null, status);
        jobStore.markHost(jobId, host, HostJobState.SKIPPED_COOLDOWN,
                "cooling down until " + health.getCooldownUntil(), health.getCooldownUntil());
        log.info("Host skipped, cooling down: provider={}, job_id={}, host={}, cooldown_until={}",
                provider, jobId, host, health.getCooldownUntil());
    }

    private RefreshOutcome finalizeJob(ScopeKey key, String jobId, Tally tally, boolean deadlineReached) {
        int ok = tally.ok.get();
        int failed = tally.failed.get();
        boolean allFailed = ok == 0 && failed > 0;

        if (allFailed) {
            snapshotStore.markStale(key, ALL_HOSTS_FAILED);
        } else if (ok > 0) {
            snapshotStore.clearStale(key);
            snapshotStore.markRefreshed(key, clock.instant().plus(snapshotStore.maxAge(key.getScope())));
        }
        snapshotStore.persist(key);

        String message = null;
        if (deadlineReached) {
            message = JOB_MAX_DURATION_REACHED;
        } else if (allFailed) {
            message = ALL_HOSTS_FAILED;
        } else if (failed > 0) {
            message = PARTIAL;
        }

        JobStatus job;
        try {
            job = jobStore.attachResult(jobId, key.asString(), message);
        } catch (JobNotFoundException e) {
            log.warn("Job pruned before its result was attached: provider={}, job_id={}", provider, jobId);
            job = null;
        }

        SnapshotPayload snapshot = snapshotStore.getSnapshot(key).orElseGet(() -> snapshotStore.initSnapshot(key));
        log.info("Refresh finished: provider={}, scope_key={}, job_id={}, ok={}, failed={}, skipped={}, stale={}",
                provider, key.asString(), jobId, ok, failed, tally.skipped.get(), snapshot.isStale());
        return new RefreshOutcome(job, snapshot, allFailed);
    }

    /**
     * A host whose last success is older than the scope's max age no longer backs its cached
     * records with a recent collection.
     */
    private boolean isOutdated(ScopeKey key, Instant lastSuccessAt) {
        return Duration.between(lastSuccessAt, clock.instant()).compareTo(snapshotStore.maxAge(key.getScope())) > 0;
    }

    private List<InventoryRecord> sanitize(String host, List<InventoryRecord> records) {
        List<InventoryRecord> clean = new ArrayList<>();
        if (records == null) {
            return clean;
        }
        for (InventoryRecord record : records) {
            if (record == null) {
                continue;
            }
            InventoryRecord copy = record.copy();
            if (copy.getHost() == null || copy.getHost().isBlank()) {
                copy.setHost(host);
            }
            copy.setProvider(provider);
            clean.add(copy);
        }
        return clean;
    }

    private static String errorType(Throwable error) {
        return error == null ? "error" : error.getClass().getSimpleName();
    }

    private static String errorMessage(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    static final class InFlightRefresh {
        private final JobStatus job;
        private final CompletableFuture<RefreshOutcome> result = new CompletableFuture<>();

        InFlightRefresh(JobStatus job) {
            this.job = job;
        }

        JobStatus getJob() {
            return job;
        }

        String getJobId() {
            return job.getJobId();
        }

        CompletableFuture<RefreshOutcome> getResult() {
            return result;
        }
    }

    private static final class HostTask {
        private final String host;
        private final AtomicBoolean settled = new AtomicBoolean();
        private Future<?> future;

        HostTask(String host) {
            this.host = host;
        }

        boolean claim() {
            return settled.compareAndSet(false, true);
        }

        boolean isClaimed() {
            return settled.get();
        }
    }

    private static final class Tally {
        private final AtomicInteger ok = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
    }
}
