package com.invdash.refresh;

import com.invdash.config.InventoryProperties;
import com.invdash.model.ScopeKey;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically triggers a non-forced refresh of configured scopes so their snapshots exist
 * before anyone asks for them.
 */
@Component
public class WarmupScheduler {
    private static final Logger log = LoggerFactory.getLogger(WarmupScheduler.class);

    private final InventoryService inventoryService;
    private final InventoryProperties.WarmupProperties warmup;
    private ScheduledExecutorService scheduler;

    public WarmupScheduler(InventoryService inventoryService, InventoryProperties properties) {
        this.inventoryService = inventoryService;
        this.warmup = properties.getWarmup();
    }

    @PostConstruct
    public void start() {
        if (!warmup.isEnabled() || warmup.getTargets().isEmpty()) {
            log.info("Warmup disabled: enabled={}, targets={}", warmup.isEnabled(), warmup.getTargets().size());
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "inventory-warmup");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(
                this::warmAll,
                warmup.getInitialDelay().toMillis(),
                warmup.getInterval().toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("Warmup scheduled: targets={}, interval={}", warmup.getTargets().size(), warmup.getInterval());
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Triggers one warmup round over every configured target.
     *
     * @return number of refresh jobs started
     */
    public int warmAll() {
        int started = 0;
        List<InventoryProperties.WarmupTarget> targets = warmup.getTargets();
        for (InventoryProperties.WarmupTarget target : targets) {
            try {
                if (warm(target)) {
                    started++;
                }
            } catch (RuntimeException e) {
                // a bad target must not stop the schedule
                log.warn("Warmup failed: provider={}, scope={}, hosts={}, error={}",
                        target.getProvider(), target.getScope(), target.getHosts(), e.getMessage());
            }
        }
        return started;
    }

    private boolean warm(InventoryProperties.WarmupTarget target) {
        ScopeKey key = InventoryService.scopeKey(target.getScope(), target.getHosts(), target.getLevel());
        if (inventoryService.isRefreshing(target.getProvider(), key)) {
            log.debug("Warmup skipped, refresh in flight: provider={}, scope_key={}", target.getProvider(), key.asString());
            return false;
        }
        return inventoryService
                .triggerRefresh(target.getProvider(), target.getScope(), target.getHosts(), target.getLevel(), false)
                .map(job -> {
                    log.info("Warmup refresh started: provider={}, scope_key={}, job_id={}",
                            target.getProvider(), key.asString(), job.getJobId());
                    return true;
                })
                .orElse(false);
    }
}
