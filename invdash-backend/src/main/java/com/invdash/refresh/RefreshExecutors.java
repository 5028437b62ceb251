package com.invdash.refresh;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools shared by every provider's refresh orchestrator.
 *
 * <ul>
 *   <li>jobs: one thread per running job, bounded by {@code maxConcurrentJobs}</li>
 *   <li>hosts: one thread per host unit of work, bounded by {@code hostWorkers}</li>
 *   <li>calls: the blocking collector calls, so a host worker can give up on one after its timeout</li>
 * </ul>
 */
public class RefreshExecutors {
    private static final Logger log = LoggerFactory.getLogger(RefreshExecutors.class);

    private final ExecutorService jobExecutor;
    private final ExecutorService hostExecutor;
    private final ExecutorService callExecutor;

    public RefreshExecutors(int maxConcurrentJobs, int hostWorkers) {
        if (maxConcurrentJobs < 1 || hostWorkers < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs and hostWorkers must be >= 1");
        }
        this.jobExecutor = Executors.newFixedThreadPool(maxConcurrentJobs, daemonThreads("refresh-job"));
        this.hostExecutor = Executors.newFixedThreadPool(hostWorkers, daemonThreads("refresh-host"));
        this.callExecutor = Executors.newCachedThreadPool(daemonThreads("collector-call"));
    }

    public ExecutorService jobs() {
        return jobExecutor;
    }

    public ExecutorService hosts() {
        return hostExecutor;
    }

    public ExecutorService calls() {
        return callExecutor;
    }

    public void shutdown() {
        jobExecutor.shutdownNow();
        hostExecutor.shutdownNow();
        callExecutor.shutdownNow();
        try {
            if (!jobExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Refresh job threads did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping refresh executors");
        }
        log.info("Refresh executors shut down");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
