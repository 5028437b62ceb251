package com.invdash.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;

/**
 * Aggregate job progress. {@code done + error + pending + skipped == totalHosts} always holds;
 * hosts that are still running count as pending.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobProgress {
    private int totalHosts;
    private int done;
    private int error;
    private int pending;
    private int skipped;

    public static JobProgress of(Collection<HostJobStatus> statuses) {
        JobProgress progress = new JobProgress();
        progress.setTotalHosts(statuses.size());
        for (HostJobStatus status : statuses) {
            HostJobState state = status.getState();
            if (state == HostJobState.OK) {
                progress.done++;
            } else if (state == HostJobState.ERROR || state == HostJobState.TIMEOUT) {
                progress.error++;
            } else if (state == HostJobState.SKIPPED_COOLDOWN) {
                progress.skipped++;
            } else {
                progress.pending++;
            }
        }
        return progress;
    }

    public boolean isComplete() {
        return pending == 0;
    }

    public JobProgress copy() {
        return toBuilder().build();
    }
}
