package com.invdash.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invdash.refresh.HostCollectionLocks;
import com.invdash.refresh.RefreshExecutors;
import com.invdash.refresh.RefreshSettings;
import com.invdash.store.HostHealthStore;
import com.invdash.store.JdbcSnapshotRepository;
import com.invdash.store.NoopSnapshotRepository;
import com.invdash.store.SnapshotRepository;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the stores and pools shared by all providers.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(InventoryProperties.class)
public class InventoryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HostHealthStore hostHealthStore(Clock clock, InventoryProperties properties) {
        InventoryProperties.HealthProperties health = properties.getHealth();
        return new HostHealthStore(clock, health.getFailureThreshold(), health.getBaseCooldown(), health.getMaxCooldown());
    }

    @Bean
    public HostCollectionLocks hostCollectionLocks() {
        return new HostCollectionLocks();
    }

    @Bean(destroyMethod = "shutdown")
    public RefreshExecutors refreshExecutors(InventoryProperties properties) {
        InventoryProperties.JobProperties jobs = properties.getJobs();
        return new RefreshExecutors(jobs.getMaxConcurrentJobs(), jobs.getHostWorkers());
    }

    @Bean
    public RefreshSettings refreshSettings(InventoryProperties properties) {
        return RefreshSettings.builder()
                .hostTimeout(properties.getJobs().getHostTimeout())
                .jobMaxDuration(properties.getJobs().getMaxDuration())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "invdash.persistence", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HikariDataSource snapshotDataSource(InventoryProperties properties) {
        InventoryProperties.PersistenceProperties persistence = properties.getPersistence();
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(PersistenceSqlExceptionOverride.class.getName());
        config.setJdbcUrl(persistence.getJdbcUrl());
        config.setUsername(persistence.getUsername());
        config.setPassword(persistence.getPassword());
        config.setConnectionTimeout(persistence.getConnectionTimeoutMs());
        config.setMaximumPoolSize(persistence.getMaxPoolSize());
        config.setMinimumIdle(1);
        config.setPoolName("Pool-snapshots");
        log.info("Snapshot persistence enabled: jdbc_url={}", persistence.getJdbcUrl());
        return new HikariDataSource(config);
    }

    @Bean
    public SnapshotRepository snapshotRepository(
            ObjectProvider<HikariDataSource> snapshotDataSource,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        HikariDataSource dataSource = snapshotDataSource.getIfAvailable();
        if (dataSource == null) {
            log.info("Snapshot persistence disabled, snapshots are kept in memory only");
            return new NoopSnapshotRepository();
        }
        JdbcSnapshotRepository repository = new JdbcSnapshotRepository(dataSource, objectMapper, clock);
        repository.initializeSchema();
        return repository;
    }
}
