package com.invdash.store;

import com.invdash.MutableClock;
import com.invdash.model.HostHealthRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HostHealthStoreTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private HostHealthStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new HostHealthStore(clock, 3, Duration.ofMinutes(10), Duration.ofMinutes(120));
    }

    @Test
    void coolsDownOnceThresholdIsReached() {
        store.recordFailure("esx-01");
        store.recordFailure("esx-01");
        assertThat(store.isCoolingDown("esx-01")).isFalse();

        HostHealthRecord third = store.recordFailure("ESX-01", "timeout", "no answer");

        assertThat(third.getConsecutiveFailures()).isEqualTo(3);
        assertThat(third.getCooldownUntil()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        assertThat(third.getLastErrorType()).isEqualTo("timeout");
        assertThat(store.isCoolingDown("esx-01")).isTrue();
    }

    @Test
    void cooldownEndsWhenTheWindowPasses() {
        for (int i = 0; i < 3; i++) {
            store.recordFailure("esx-01");
        }

        clock.advance(Duration.ofMinutes(10));

        assertThat(store.isCoolingDown("esx-01")).isFalse();
    }

    @Test
    void backoffDoublesAndIsCapped() {
        assertThat(store.backoff(2)).isEqualTo(Duration.ZERO);
        assertThat(store.backoff(3)).isEqualTo(Duration.ofMinutes(10));
        assertThat(store.backoff(4)).isEqualTo(Duration.ofMinutes(20));
        assertThat(store.backoff(6)).isEqualTo(Duration.ofMinutes(80));
        assertThat(store.backoff(7)).isEqualTo(Duration.ofMinutes(120));
        assertThat(store.backoff(500)).isEqualTo(Duration.ofMinutes(120));
    }

    @Test
    void successResetsCounterAndCooldown() {
        for (int i = 0; i < 4; i++) {
            store.recordFailure("esx-01", "error", "boom");
        }

        clock.advance(Duration.ofMinutes(1));
        HostHealthRecord rec = store.recordSuccess("esx-01");

        assertThat(rec.getConsecutiveFailures()).isZero();
        assertThat(rec.getCooldownUntil()).isNull();
        assertThat(rec.getLastErrorMessage()).isNull();
        assertThat(rec.getLastSuccessAt()).isEqualTo(T0.plus(Duration.ofMinutes(1)));
        assertThat(rec.getLastErrorAt()).isEqualTo(T0);
        assertThat(store.isCoolingDown("esx-01")).isFalse();
    }

    @Test
    void unknownHostIsHealthy() {
        HostHealthRecord rec = store.get("never-seen");

        assertThat(rec.getHostId()).isEqualTo("never-seen");
        assertThat(rec.getConsecutiveFailures()).isZero();
        assertThat(store.isCoolingDown("never-seen")).isFalse();
    }

    @Test
    void returnedRecordsAreCopies() {
        HostHealthRecord rec = store.recordFailure("esx-01");
        rec.setConsecutiveFailures(99);

        assertThat(store.get("esx-01").getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new HostHealthStore(clock, 0, Duration.ofMinutes(1), Duration.ofMinutes(2)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HostHealthStore(clock, 3, Duration.ofMinutes(10), Duration.ofMinutes(5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.recordFailure(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
