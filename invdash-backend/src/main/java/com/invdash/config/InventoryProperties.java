package com.invdash.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "invdash")
public class InventoryProperties {

    private RefreshProperties refresh = new RefreshProperties();
    private HealthProperties health = new HealthProperties();
    private JobProperties jobs = new JobProperties();
    private PersistenceProperties persistence = new PersistenceProperties();
    private WarmupProperties warmup = new WarmupProperties();

    @Data
    public static class RefreshProperties {
        // max age of a vms snapshot before it is refreshed on read
        private Duration vmsMaxAge = Duration.ofMinutes(10);
        private Duration hostsMaxAge = Duration.ofMinutes(30);
        private int maxRetainedSnapshots = 128;
        private Duration snapshotRetention = Duration.ofHours(24);
    }

    @Data
    public static class HealthProperties {
        private int failureThreshold = 3;
        private Duration baseCooldown = Duration.ofMinutes(10);
        private Duration maxCooldown = Duration.ofMinutes(120);
    }

    @Data
    public static class JobProperties {
        private int maxConcurrentJobs = 4;
        private int hostWorkers = 4;
        private Duration hostTimeout = Duration.ofSeconds(150);
        private Duration maxDuration = Duration.ofMinutes(15);
        private int maxRetained = 128;
        private Duration retention = Duration.ofHours(24);
    }

    @Data
    public static class PersistenceProperties {
        private boolean enabled = true;
        private String jdbcUrl = "jdbc:h2:file:./data/invdash;AUTO_SERVER=TRUE";
        private String username = "sa";
        private String password = "";
        private int maxPoolSize = 4;
        private long connectionTimeoutMs = 10_000;
    }

    @Data
    public static class WarmupProperties {
        private boolean enabled = false;
        private Duration initialDelay = Duration.ofSeconds(30);
        private Duration interval = Duration.ofMinutes(5);
        private List<WarmupTarget> targets = new ArrayList<>();
    }

    /**
     * One scope kept warm by the warmup scheduler.
     */
    @Data
    public static class WarmupTarget {
        private String provider;
        private String scope;
        private List<String> hosts = new ArrayList<>();
        private String level;
    }
}
