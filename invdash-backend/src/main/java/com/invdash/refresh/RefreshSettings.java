package com.invdash.refresh;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Time budgets of a refresh: per-host collector timeout and overall job deadline.
 */
@Value
@Builder
public class RefreshSettings {
    Duration hostTimeout;
    Duration jobMaxDuration;
}
