package com.invdash.store;

import com.invdash.model.HostJobState;
import com.invdash.model.HostJobStatus;
import com.invdash.model.JobProgress;
import com.invdash.model.JobState;
import com.invdash.model.JobStatus;
import com.invdash.model.ScopeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory lifecycle of refresh jobs with one active job index per {@link ScopeKey}.
 *
 * <p>Every read returns a copy. Progress is recomputed from the full per-host map on every
 * mutation, and the job turns terminal on the same mutation that makes its last host terminal.
 */
public class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final Object lock = new Object();
    private final LinkedHashMap<String, JobStatus> jobs = new LinkedHashMap<>();
    private final Map<ScopeKey, String> activeByScope = new HashMap<>();

    private final Clock clock;
    private final int maxRetained;
    private final Duration retention;

    public JobStore(Clock clock, int maxRetained, Duration retention) {
        if (maxRetained < 1) {
            throw new IllegalArgumentException("maxRetained must be >= 1");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxRetained = maxRetained;
        this.retention = Objects.requireNonNull(retention, "retention");
    }

    /**
     * Creates a pending job with one pending host entry per host of the key and registers it as
     * the scope's active job.
     *
     * @param scopeKey normalized scope key
     * @return copy of the new job
     */
    public JobStatus createJob(ScopeKey scopeKey) {
        Objects.requireNonNull(scopeKey, "scopeKey");
        Instant now = clock.instant();
        Map<String, HostJobStatus> hosts = new LinkedHashMap<>();
        for (String host : scopeKey.getHosts()) {
            hosts.put(host, HostJobStatus.pending());
        }
        JobStatus job = JobStatus.builder()
                .jobId(UUID.randomUUID().toString().replace("-", ""))
                .scope(scopeKey.getScope())
                .hosts(new ArrayList<>(scopeKey.getHosts()))
                .level(scopeKey.getLevel())
                .status(JobState.PENDING)
                .createdAt(now)
                .hostsStatus(hosts)
                .progress(JobProgress.of(hosts.values()))
                .build();
        synchronized (lock) {
            pruneLocked(now);
            jobs.put(job.getJobId(), job);
            activeByScope.put(scopeKey, job.getJobId());
            log.info("Created refresh job: job_id={}, scope_key={}, total_hosts={}",
                    job.getJobId(), scopeKey.asString(), hosts.size());
            return job.copy();
        }
    }

    /**
     * Moves a pending job to running. A job without hosts completes immediately.
     */
    public JobStatus startJob(String jobId) {
        Instant now = clock.instant();
        synchronized (lock) {
            JobStatus job = requireJob(jobId);
            if (job.getStatus() == JobState.PENDING) {
                job.setStatus(JobState.RUNNING);
                job.setStartedAt(now);
            }
            job.setLastHeartbeatAt(now);
            finishIfCompleteLocked(job, now);
            return job.copy();
        }
    }

    public JobStatus markHost(String jobId, String hostId, HostJobState state) {
        return markHost(jobId, hostId, state, null, null);
    }

    public JobStatus markHost(String jobId, String hostId, HostJobState state, String error) {
        return markHost(jobId, hostId, state, error, null);
    }

    /**
     * Transitions exactly one host of a job.
     *
     * @param jobId job id
     * @param hostId host id (normalized for lookup)
     * @param state target state
     * @param error error message, kept as {@code last_error}
     * @param cooldownUntil cooldown window reported by host health, if any
     * @return copy of the updated job
     * @throws JobNotFoundException if the job is unknown
     * @throws HostTransitionException if the host is not part of the job or already terminal
     */
    public JobStatus markHost(String jobId, String hostId, HostJobState state, String error, Instant cooldownUntil) {
        String host = ScopeKey.normalizeHost(hostId);
        Instant now = clock.instant();
        synchronized (lock) {
            JobStatus job = requireJob(jobId);
            HostJobStatus current = job.getHostsStatus().get(host);
            if (current == null) {
                throw new HostTransitionException(jobId, host, null, state);
            }
            if (!current.getState().canTransitionTo(state)) {
                throw new HostTransitionException(jobId, host, current.getState(), state);
            }

            if (state == HostJobState.RUNNING || (current.getState() == HostJobState.PENDING && state != HostJobState.SKIPPED_COOLDOWN)) {
                current.setAttempt(current.getAttempt() + 1);
            }
            if (current.getStartedAt() == null) {
                current.setStartedAt(now);
            }
            if (state.isTerminal()) {
                current.setFinishedAt(now);
            }
            current.setState(state);
            current.setLastError(error);
            current.setCooldownUntil(cooldownUntil);

            if (job.getStatus() == JobState.PENDING) {
                job.setStatus(JobState.RUNNING);
                job.setStartedAt(now);
            }
            job.setLastHeartbeatAt(now);
            job.setProgress(JobProgress.of(job.getHostsStatus().values()));
            finishIfCompleteLocked(job, now);
            return job.copy();
        }
    }

    public Optional<JobStatus> getJob(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            JobStatus job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.copy());
        }
    }

    /**
     * Returns the scope's job while it is still pending or running.
     */
    public Optional<JobStatus> getActiveForScope(ScopeKey scopeKey) {
        synchronized (lock) {
            String jobId = activeByScope.get(scopeKey);
            if (jobId == null) {
                return Optional.empty();
            }
            JobStatus job = jobs.get(jobId);
            if (job == null || job.getStatus().isTerminal()) {
                activeByScope.remove(scopeKey);
                return Optional.empty();
            }
            return Optional.of(job.copy());
        }
    }

    /**
     * Updates {@code last_heartbeat_at}, which watchdogs use to detect abandoned jobs.
     */
    public JobStatus heartbeat(String jobId) {
        Instant now = clock.instant();
        synchronized (lock) {
            JobStatus job = requireJob(jobId);
            job.setLastHeartbeatAt(now);
            return job.copy();
        }
    }

    /**
     * Records where the job's result was written and a short outcome message.
     */
    public JobStatus attachResult(String jobId, String snapshotKey, String message) {
        synchronized (lock) {
            JobStatus job = requireJob(jobId);
            job.setSnapshotKey(snapshotKey);
            job.setMessage(message);
            return job.copy();
        }
    }

    public int size() {
        synchronized (lock) {
            return jobs.size();
        }
    }

    private JobStatus requireJob(String jobId) {
        JobStatus job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private void finishIfCompleteLocked(JobStatus job, Instant now) {
        if (job.getStatus().isTerminal()) {
            return;
        }
        JobProgress progress = JobProgress.of(job.getHostsStatus().values());
        job.setProgress(progress);
        if (!progress.isComplete()) {
            return;
        }
        boolean anyFailed = progress.getError() > 0;
        job.setStatus(progress.getDone() > 0 || !anyFailed ? JobState.DONE : JobState.ERROR);
        job.setFinishedAt(now);
        if (job.getStartedAt() == null) {
            job.setStartedAt(now);
        }
        ScopeKey key = ScopeKey.of(job.getScope(), job.getHosts(), job.getLevel());
        activeByScope.remove(key, job.getJobId());
        log.info("Refresh job finished: job_id={}, status={}, done={}, error={}, skipped={}",
                job.getJobId(), job.getStatus().getValue(), progress.getDone(), progress.getError(), progress.getSkipped());
    }

    private void pruneLocked(Instant now) {
        if (jobs.size() < maxRetained) {
            return;
        }
        Instant cutoff = now.minus(retention);
        List<String> removed = new ArrayList<>();
        Iterator<Map.Entry<String, JobStatus>> it = jobs.entrySet().iterator();
        while (it.hasNext() && jobs.size() >= maxRetained) {
            JobStatus job = it.next().getValue();
            if (job.getStatus().isTerminal() || job.getCreatedAt().isBefore(cutoff)) {
                it.remove();
                removed.add(job.getJobId());
            }
        }
        activeByScope.values().removeIf(id -> !jobs.containsKey(id));
        if (!removed.isEmpty()) {
            log.debug("Pruned {} refresh jobs, retained={}", removed.size(), jobs.size());
        }
    }
}
