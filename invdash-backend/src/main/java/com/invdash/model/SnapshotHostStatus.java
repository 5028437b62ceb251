package com.invdash.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SnapshotHostStatus {
    private SnapshotHostState state;
    private Instant lastSuccessAt;
    private Instant lastErrorAt;
    private Instant cooldownUntil;
    private String lastJobId;
    private String lastErrorType;
    private String lastErrorMessage;

    public static SnapshotHostStatus of(SnapshotHostState state) {
        return SnapshotHostStatus.builder().state(state).build();
    }

    public SnapshotHostStatus copy() {
        return toBuilder().build();
    }
}
