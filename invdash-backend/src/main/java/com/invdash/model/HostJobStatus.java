package com.invdash.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Transient per-host status owned by one refresh job.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HostJobStatus {
    private HostJobState state;
    private int attempt;
    private Instant startedAt;
    private Instant finishedAt;
    private String lastError;
    private Instant cooldownUntil;

    public static HostJobStatus pending() {
        return HostJobStatus.builder().state(HostJobState.PENDING).build();
    }

    public HostJobStatus copy() {
        return toBuilder().build();
    }
}
