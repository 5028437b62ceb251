package com.invdash.collector;

import com.invdash.model.ScopeName;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What a collector call is part of.
 */
@Value
@Builder
public class CollectorContext {
    String provider;
    ScopeName scope;
    String jobId;
    int attempt;
    Instant deadline;
}
