package com.invdash.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.invdash.MutableClock;
import com.invdash.model.InventoryRecord;
import com.invdash.model.ScopeKey;
import com.invdash.model.ScopeName;
import com.invdash.model.SnapshotData;
import com.invdash.model.SnapshotHostState;
import com.invdash.model.SnapshotHostStatus;
import com.invdash.model.SnapshotPayload;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcSnapshotRepositoryTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private HikariDataSource dataSource;
    private MutableClock clock;
    private JdbcSnapshotRepository repository;

    @BeforeEach
    void setUp() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:snapshots-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(2);
        dataSource = new HikariDataSource(config);
        clock = new MutableClock(T0);
        repository = new JdbcSnapshotRepository(dataSource, mapper, clock);
        repository.initializeSchema();
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    void persistedPayloadReloadsEqual() {
        SnapshotStore store = newStore(repository);
        ScopeKey key = ScopeKey.of(ScopeName.VMS, List.of("esx-01", "esx-02"));
        store.upsertHost(key, "ESX-01", List.of(InventoryRecord.of(null, Map.of("name", "vm-a", "cpu", 4))),
                SnapshotHostStatus.builder().state(SnapshotHostState.OK).lastSuccessAt(T0).lastJobId("j1").build());
        store.upsertHost(key, "esx-02", null,
                SnapshotHostStatus.builder().state(SnapshotHostState.TIMEOUT).lastErrorAt(T0)
                        .lastErrorType("timeout").lastErrorMessage("no answer").build());
        store.markRefreshed(key, T0.plus(Duration.ofMinutes(10)));

        SnapshotPayload written = store.persist(key).orElseThrow();
        Optional<SnapshotPayload> loaded = repository.load("vmware", ScopeName.VMS, key.hostsKey(), key.getLevel());

        assertThat(loaded).contains(written);
    }

    @Test
    void saveOverwritesTheSameKey() {
        ScopeKey key = ScopeKey.of(ScopeName.HOSTS, List.of("p-hyp-01"));
        SnapshotPayload first = SnapshotPayload.empty(key, T0);
        SnapshotPayload second = SnapshotPayload.empty(key, T0.plusSeconds(60));
        second.getData().replace("P-HYP-01", List.of(InventoryRecord.of("P-HYP-01", Map.of("total_vms", 2))));

        repository.save("hyperv", ScopeName.HOSTS, key.hostsKey(), key.getLevel(), first);
        clock.advance(Duration.ofMinutes(1));
        repository.save("hyperv", ScopeName.HOSTS, key.hostsKey(), key.getLevel(), second);

        assertThat(repository.load("hyperv", ScopeName.HOSTS, key.hostsKey(), key.getLevel())).contains(second);
    }

    @Test
    void providerIsPartOfTheKey() {
        ScopeKey key = ScopeKey.of(ScopeName.VMS, List.of("h1"));
        repository.save("vmware", ScopeName.VMS, key.hostsKey(), key.getLevel(), SnapshotPayload.empty(key, T0));

        assertThat(repository.load("hyperv", ScopeName.VMS, key.hostsKey(), key.getLevel())).isEmpty();
        assertThat(repository.load("vmware", ScopeName.HOSTS, key.hostsKey(), key.getLevel())).isEmpty();
    }

    @Test
    void coldStoreHydratesFromDatabase() {
        ScopeKey key = ScopeKey.of(ScopeName.VMS, List.of("esx-01"));
        SnapshotStore before = newStore(repository);
        before.upsertHost(key, "esx-01", List.of(InventoryRecord.of(null, Map.of("name", "vm-a"))),
                SnapshotHostStatus.of(SnapshotHostState.OK));
        before.persist(key);

        SnapshotStore restarted = newStore(repository);
        Optional<SnapshotPayload> hydrated = restarted.getSnapshot(key);

        assertThat(hydrated).hasValueSatisfying(s -> {
            assertThat(s.getSource()).isEqualTo(SnapshotPayload.SOURCE_DB);
            assertThat(s.getData().recordsFor("esx-01")).isPresent();
            assertThat(s.getSummary()).containsEntry("ok", 1);
        });
    }

    @Test
    void hostRecordNamedDifferentlyByTheCollectorReloadsEqualAndIsReplacedInPlace() {
        ScopeKey key = ScopeKey.of(ScopeName.HOSTS, List.of("esx01"));
        SnapshotStore before = newStore(repository);
        before.upsertHost(key, "esx01", List.of(InventoryRecord.of("esx01.lab.local", Map.of("total_vms", 2))),
                SnapshotHostStatus.of(SnapshotHostState.OK));
        SnapshotPayload written = before.persist(key).orElseThrow();

        assertThat(repository.load("vmware", ScopeName.HOSTS, key.hostsKey(), key.getLevel())).contains(written);

        SnapshotStore restarted = newStore(repository);
        assertThat(restarted.getSnapshot(key)).isPresent();
        SnapshotPayload recollected = restarted.upsertHost(key, "esx01",
                List.of(InventoryRecord.of("esx01.lab.local", Map.of("total_vms", 3))),
                SnapshotHostStatus.of(SnapshotHostState.OK));

        assertThat(recollected.getData().recordCount()).isEqualTo(1);
        assertThat(recollected.getData().recordsFor("esx01")).hasValueSatisfying(records -> {
            assertThat(records.get(0).getHost()).isEqualTo("esx01");
            assertThat(records.get(0).get("total_vms")).isEqualTo(3);
            assertThat(records.get(0).get(SnapshotData.REPORTED_HOST)).isEqualTo("esx01.lab.local");
        });
    }

    @Test
    void scopeWithManyHostsIsStoredUnderItsFullKey() {
        List<String> hosts = IntStream.range(0, 600)
                .mapToObj(i -> "esx-host-" + i + ".datacenter.example.org")
                .collect(Collectors.toList());
        ScopeKey key = ScopeKey.of(ScopeName.VMS, hosts);
        ScopeKey other = ScopeKey.of(ScopeName.VMS, hosts.subList(0, 599));
        SnapshotPayload payload = SnapshotPayload.empty(key, T0);

        repository.save("vmware", ScopeName.VMS, key.hostsKey(), key.getLevel(), payload);

        assertThat(key.hostsKey().length()).isGreaterThan(4000);
        assertThat(repository.load("vmware", ScopeName.VMS, key.hostsKey(), key.getLevel())).contains(payload);
        assertThat(repository.load("vmware", ScopeName.VMS, other.hostsKey(), other.getLevel())).isEmpty();
    }

    private SnapshotStore newStore(SnapshotRepository repo) {
        return new SnapshotStore("vmware", repo, clock,
                Map.of(ScopeName.VMS, Duration.ofMinutes(10), ScopeName.HOSTS, Duration.ofMinutes(30)),
                128, Duration.ofHours(24));
    }
}
