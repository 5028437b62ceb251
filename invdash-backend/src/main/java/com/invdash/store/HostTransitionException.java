package com.invdash.store;

import com.invdash.model.HostJobState;

/**
 * Thrown when a per-host job update is not a legal transition: the host is not part of the job,
 * or its state is already terminal. The job is left untouched.
 */
public class HostTransitionException extends IllegalStateException {
    private final String jobId;
    private final String hostId;
    private final HostJobState from;
    private final HostJobState to;

    public HostTransitionException(String jobId, String hostId, HostJobState from, HostJobState to) {
        super(from == null
                ? "Host " + hostId + " is not part of job " + jobId
                : "Illegal host transition in job " + jobId + ": host=" + hostId + ", " + from.getValue() + " -> " + (to == null ? "null" : to.getValue()));
        this.jobId = jobId;
        this.hostId = hostId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() {
        return jobId;
    }

    public String getHostId() {
        return hostId;
    }

    public HostJobState getFrom() {
        return from;
    }

    public HostJobState getTo() {
        return to;
    }
}
