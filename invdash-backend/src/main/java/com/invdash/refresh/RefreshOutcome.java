package com.invdash.refresh;

import com.invdash.model.JobStatus;
import com.invdash.model.SnapshotPayload;
import lombok.Value;

/**
 * Result of one completed refresh job.
 */
@Value
public class RefreshOutcome {
    JobStatus job;
    SnapshotPayload snapshot;
    boolean allFailed;
}
