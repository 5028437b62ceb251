package com.invdash.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cached inventory of one {@link ScopeKey}. Owned by the snapshot store; callers only see copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SnapshotPayload {
    public static final String SOURCE_MEMORY = "memory";
    public static final String SOURCE_DB = "db";

    private ScopeName scope;
    private List<String> hosts;
    private String level;
    private Instant generatedAt;
    private String source;
    private Instant expiresAt;
    private boolean stale;
    private String staleReason;
    private int totalHosts;
    private Map<String, SnapshotHostStatus> hostsStatus;
    private Map<String, Integer> summary;
    private SnapshotData data;

    /**
     * Empty payload with every host of the key pending.
     */
    public static SnapshotPayload empty(ScopeKey key, Instant now) {
        Map<String, SnapshotHostStatus> statuses = new LinkedHashMap<>();
        for (String host : key.getHosts()) {
            statuses.put(host, SnapshotHostStatus.of(SnapshotHostState.PENDING));
        }
        SnapshotPayload payload = SnapshotPayload.builder()
                .scope(key.getScope())
                .hosts(new ArrayList<>(key.getHosts()))
                .level(key.getLevel())
                .generatedAt(now)
                .hostsStatus(statuses)
                .summary(new LinkedHashMap<>())
                .data(SnapshotData.empty(key.getScope()))
                .build();
        payload.recomputeCounters();
        return payload;
    }

    @JsonIgnore
    public ScopeKey getScopeKey() {
        return ScopeKey.of(scope, hosts, level);
    }

    /**
     * True once any refresh of this scope succeeded, even if it collected no records. Only a
     * successful refresh stamps {@code expires_at}; a payload loaded without it counts when it
     * carries data.
     */
    @JsonIgnore
    public boolean isEverRefreshed() {
        return expiresAt != null || (data != null && !data.isEmpty());
    }

    /**
     * Recomputes {@code summary} and {@code totalHosts} from {@code hostsStatus}.
     */
    public void recomputeCounters() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (hostsStatus != null) {
            for (SnapshotHostStatus status : hostsStatus.values()) {
                SnapshotHostState state = status.getState() == null ? SnapshotHostState.PENDING : status.getState();
                counts.merge(state.getValue(), 1, Integer::sum);
            }
        }
        summary = counts;
        totalHosts = hostsStatus == null ? 0 : hostsStatus.size();
    }

    public SnapshotPayload copy() {
        Map<String, SnapshotHostStatus> statuses = new LinkedHashMap<>();
        if (hostsStatus != null) {
            hostsStatus.forEach((host, status) -> statuses.put(host, status.copy()));
        }
        return toBuilder()
                .hosts(hosts == null ? null : new ArrayList<>(hosts))
                .hostsStatus(statuses)
                .summary(summary == null ? null : new LinkedHashMap<>(summary))
                .data(data == null ? null : data.copy())
                .build();
    }
}
