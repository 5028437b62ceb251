package com.invdash.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cross-scope health of one host: consecutive failures and the cooldown window they produced.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HostHealthRecord {
    private String hostId;
    private int consecutiveFailures;
    private Instant cooldownUntil;
    private Instant lastSuccessAt;
    private Instant lastErrorAt;
    private String lastErrorType;
    private String lastErrorMessage;

    public HostHealthRecord copy() {
        return toBuilder().build();
    }
}
