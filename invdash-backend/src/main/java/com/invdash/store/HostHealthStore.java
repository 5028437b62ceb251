package com.invdash.store;

import com.invdash.model.HostHealthRecord;
import com.invdash.model.ScopeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tracks consecutive failures and cooldown windows per host.
 *
 * <p>Host health is cross-scope: one instance is shared by every job and every provider. A host
 * enters cooldown once its consecutive failures reach the threshold; the window then doubles per
 * further failure up to {@code maxCooldown}. Any success clears it.
 */
public class HostHealthStore {
    private static final Logger log = LoggerFactory.getLogger(HostHealthStore.class);

    private final Object lock = new Object();
    private final Map<String, HostHealthRecord> records = new HashMap<>();

    private final Clock clock;
    private final int failureThreshold;
    private final Duration baseCooldown;
    private final Duration maxCooldown;

    /**
     * Creates a host health store.
     *
     * @param clock time source
     * @param failureThreshold consecutive failures before a host cools down (at least 1)
     * @param baseCooldown cooldown applied when the threshold is first reached
     * @param maxCooldown upper bound of the cooldown window
     */
    public HostHealthStore(Clock clock, int failureThreshold, Duration baseCooldown, Duration maxCooldown) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (baseCooldown == null || baseCooldown.isNegative() || baseCooldown.isZero()) {
            throw new IllegalArgumentException("baseCooldown must be positive");
        }
        if (maxCooldown == null || maxCooldown.compareTo(baseCooldown) < 0) {
            throw new IllegalArgumentException("maxCooldown must be >= baseCooldown");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.failureThreshold = failureThreshold;
        this.baseCooldown = baseCooldown;
        this.maxCooldown = maxCooldown;
    }

    /**
     * Returns a copy of the host's record; unknown hosts get an empty record.
     */
    public HostHealthRecord get(String hostId) {
        String host = requireHost(hostId);
        synchronized (lock) {
            HostHealthRecord rec = records.get(host);
            return rec == null ? HostHealthRecord.builder().hostId(host).build() : rec.copy();
        }
    }

    public HostHealthRecord recordFailure(String hostId) {
        return recordFailure(hostId, null, null);
    }

    /**
     * Counts one more consecutive failure and opens (or extends) the cooldown window once the
     * threshold is reached.
     *
     * @param hostId host id
     * @param errorType short error classification, e.g. {@code timeout}
     * @param errorMessage error detail
     * @return copy of the updated record
     */
    public HostHealthRecord recordFailure(String hostId, String errorType, String errorMessage) {
        String host = requireHost(hostId);
        Instant now = clock.instant();
        HostHealthRecord result;
        synchronized (lock) {
            HostHealthRecord rec = records.computeIfAbsent(host, h -> HostHealthRecord.builder().hostId(h).build());
            rec.setConsecutiveFailures(rec.getConsecutiveFailures() + 1);
            rec.setLastErrorAt(now);
            rec.setLastErrorType(errorType);
            rec.setLastErrorMessage(errorMessage);
            if (rec.getConsecutiveFailures() >= failureThreshold) {
                rec.setCooldownUntil(now.plus(backoff(rec.getConsecutiveFailures())));
            }
            result = rec.copy();
        }
        if (result.getCooldownUntil() != null && result.getConsecutiveFailures() >= failureThreshold) {
            log.warn("Host cooling down: host={}, consecutive_failures={}, cooldown_until={}",
                    host, result.getConsecutiveFailures(), result.getCooldownUntil());
        }
        return result;
    }

    /**
     * Resets the failure counter and clears any cooldown.
     *
     * @param hostId host id
     * @return copy of the updated record
     */
    public HostHealthRecord recordSuccess(String hostId) {
        String host = requireHost(hostId);
        Instant now = clock.instant();
        synchronized (lock) {
            HostHealthRecord rec = records.computeIfAbsent(host, h -> HostHealthRecord.builder().hostId(h).build());
            if (rec.getCooldownUntil() != null) {
                log.info("Host recovered: host={}, previous_failures={}", host, rec.getConsecutiveFailures());
            }
            rec.setConsecutiveFailures(0);
            rec.setCooldownUntil(null);
            rec.setLastSuccessAt(now);
            rec.setLastErrorType(null);
            rec.setLastErrorMessage(null);
            return rec.copy();
        }
    }

    public boolean isCoolingDown(String hostId) {
        return isCoolingDown(hostId, clock.instant());
    }

    public boolean isCoolingDown(String hostId, Instant now) {
        String host = ScopeKey.normalizeHost(hostId);
        synchronized (lock) {
            HostHealthRecord rec = records.get(host);
            return rec != null && rec.getCooldownUntil() != null && rec.getCooldownUntil().isAfter(now);
        }
    }

    /**
     * Cooldown window for a given consecutive failure count: zero below the threshold, then
     * {@code baseCooldown * 2^(failures - threshold)} capped at {@code maxCooldown}.
     */
    Duration backoff(int consecutiveFailures) {
        if (consecutiveFailures < failureThreshold) {
            return Duration.ZERO;
        }
        int exponent = consecutiveFailures - failureThreshold;
        if (exponent >= 30) {
            return maxCooldown;
        }
        Duration window = baseCooldown.multipliedBy(1L << exponent);
        return window.compareTo(maxCooldown) > 0 ? maxCooldown : window;
    }

    private static String requireHost(String hostId) {
        String host = ScopeKey.normalizeHost(hostId);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host id is required");
        }
        return host;
    }
}
