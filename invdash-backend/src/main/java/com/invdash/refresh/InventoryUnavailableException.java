package com.invdash.refresh;

import com.invdash.model.ScopeKey;

/**
 * Thrown when a scope has never been collected successfully and its refresh failed on every host,
 * so there is no data at all to serve.
 */
public class InventoryUnavailableException extends RuntimeException {
    private final String provider;
    private final String scopeKey;
    private final String jobId;

    public InventoryUnavailableException(String provider, ScopeKey scopeKey, String jobId) {
        super("No inventory available for provider=" + provider + ", scope_key=" + scopeKey.asString()
                + ": every host failed and nothing was cached before");
        this.provider = provider;
        this.scopeKey = scopeKey.asString();
        this.jobId = jobId;
    }

    public String getProvider() {
        return provider;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    public String getJobId() {
        return jobId;
    }
}
