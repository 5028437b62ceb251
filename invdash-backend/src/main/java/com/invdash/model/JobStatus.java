package com.invdash.model;

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
 * One orchestrated attempt to refresh a snapshot.
 *
 * <p>Lifecycle: {@code pending -> running -> done|error}. Jobs are kept for observability after
 * completion but are never the source of served data.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobStatus {
    private String jobId;
    private ScopeName scope;
    private List<String> hosts;
    private String level;
    private JobState status;
    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant lastHeartbeatAt;
    private JobProgress progress;
    private Map<String, HostJobStatus> hostsStatus;
    private String snapshotKey;
    private String message;

    public JobStatus copy() {
        Map<String, HostJobStatus> statuses = new LinkedHashMap<>();
        if (hostsStatus != null) {
            hostsStatus.forEach((host, status) -> statuses.put(host, status.copy()));
        }
        return toBuilder()
                .hosts(hosts == null ? null : new ArrayList<>(hosts))
                .progress(progress == null ? null : progress.copy())
                .hostsStatus(statuses)
                .build();
    }
}
