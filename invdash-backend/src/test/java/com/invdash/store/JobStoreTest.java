package com.invdash.store;

import com.invdash.MutableClock;
import com.invdash.model.HostJobState;
import com.invdash.model.JobProgress;
import com.invdash.model.JobState;
import com.invdash.model.JobStatus;
import com.invdash.model.ScopeKey;
import com.invdash.model.ScopeName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStoreTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private JobStore store;
    private ScopeKey key;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new JobStore(clock, 128, Duration.ofHours(24));
        key = ScopeKey.of(ScopeName.VMS, List.of("h1", "h2", "h3"));
    }

    @Test
    void newJobIsPendingWithEveryHostPending() {
        JobStatus job = store.createJob(key);

        assertThat(job.getJobId()).hasSize(32);
        assertThat(job.getStatus()).isEqualTo(JobState.PENDING);
        assertThat(job.getHostsStatus()).containsOnlyKeys("h1", "h2", "h3");
        assertThat(job.getProgress().getPending()).isEqualTo(3);
        assertThat(store.getActiveForScope(key)).map(JobStatus::getJobId).contains(job.getJobId());
    }

    @Test
    void progressAlwaysAddsUpToTotalHosts() {
        String jobId = store.createJob(key).getJobId();
        store.startJob(jobId);

        List<JobStatus> observed = List.of(
                store.markHost(jobId, "h1", HostJobState.RUNNING),
                store.markHost(jobId, "h1", HostJobState.OK),
                store.markHost(jobId, "h2", HostJobState.SKIPPED_COOLDOWN),
                store.markHost(jobId, "h3", HostJobState.RUNNING),
                store.markHost(jobId, "h3", HostJobState.TIMEOUT, "slow"));

        for (JobStatus job : observed) {
            JobProgress p = job.getProgress();
            assertThat(p.getDone() + p.getError() + p.getPending() + p.getSkipped()).isEqualTo(p.getTotalHosts());
            assertThat(p.getTotalHosts()).isEqualTo(3);
        }
    }

    @Test
    void jobTurnsTerminalWithItsLastHost() {
        String jobId = store.createJob(key).getJobId();
        store.startJob(jobId);

        store.markHost(jobId, "h1", HostJobState.OK);
        JobStatus afterTwo = store.markHost(jobId, "h2", HostJobState.ERROR, "refused");
        assertThat(afterTwo.getStatus()).isEqualTo(JobState.RUNNING);
        assertThat(afterTwo.getFinishedAt()).isNull();

        clock.advance(Duration.ofSeconds(5));
        JobStatus done = store.markHost(jobId, "h3", HostJobState.SKIPPED_COOLDOWN);

        assertThat(done.getStatus()).isEqualTo(JobState.DONE);
        assertThat(done.getFinishedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(done.getProgress().getDone()).isEqualTo(1);
        assertThat(done.getProgress().getError()).isEqualTo(1);
        assertThat(done.getProgress().getSkipped()).isEqualTo(1);
        assertThat(store.getActiveForScope(key)).isEmpty();
    }

    @Test
    void jobWithOnlyFailuresEndsInError() {
        String jobId = store.createJob(key).getJobId();

        store.markHost(jobId, "h1", HostJobState.ERROR, "boom");
        store.markHost(jobId, "h2", HostJobState.TIMEOUT, "slow");
        JobStatus job = store.markHost(jobId, "h3", HostJobState.SKIPPED_COOLDOWN);

        assertThat(job.getStatus()).isEqualTo(JobState.ERROR);
    }

    @Test
    void terminalHostCannotRegress() {
        String jobId = store.createJob(key).getJobId();
        store.markHost(jobId, "h1", HostJobState.RUNNING);
        store.markHost(jobId, "h1", HostJobState.OK);

        assertThatThrownBy(() -> store.markHost(jobId, "h1", HostJobState.RUNNING))
                .isInstanceOfSatisfying(HostTransitionException.class, ex -> {
                    assertThat(ex.getFrom()).isEqualTo(HostJobState.OK);
                    assertThat(ex.getTo()).isEqualTo(HostJobState.RUNNING);
                });
        assertThat(store.getJob(jobId)).get()
                .extracting(job -> job.getHostsStatus().get("h1").getState())
                .isEqualTo(HostJobState.OK);
    }

    @Test
    void finishedJobNeverChangesStatusAgain() {
        ScopeKey single = ScopeKey.of(ScopeName.VMS, List.of("h1"));
        String jobId = store.createJob(single).getJobId();
        store.markHost(jobId, "h1", HostJobState.OK);

        assertThatThrownBy(() -> store.markHost(jobId, "h1", HostJobState.ERROR))
                .isInstanceOf(HostTransitionException.class);
        assertThat(store.getJob(jobId)).get().extracting(JobStatus::getStatus).isEqualTo(JobState.DONE);
    }

    @Test
    void attemptCountsEachCollectionStart() {
        String jobId = store.createJob(key).getJobId();

        JobStatus running = store.markHost(jobId, "h1", HostJobState.RUNNING);
        JobStatus ok = store.markHost(jobId, "h1", HostJobState.OK);
        JobStatus skipped = store.markHost(jobId, "h2", HostJobState.SKIPPED_COOLDOWN);

        assertThat(running.getHostsStatus().get("h1").getAttempt()).isEqualTo(1);
        assertThat(ok.getHostsStatus().get("h1").getAttempt()).isEqualTo(1);
        assertThat(skipped.getHostsStatus().get("h2").getAttempt()).isZero();
    }

    @Test
    void hostLookupIgnoresCase() {
        String jobId = store.createJob(key).getJobId();

        JobStatus job = store.markHost(jobId, " H1 ", HostJobState.RUNNING);

        assertThat(job.getHostsStatus().get("h1").getState()).isEqualTo(HostJobState.RUNNING);
        assertThat(job.getStatus()).isEqualTo(JobState.RUNNING);
    }

    @Test
    void unknownJobOrHostIsRejected() {
        String jobId = store.createJob(key).getJobId();

        assertThatThrownBy(() -> store.markHost("missing", "h1", HostJobState.OK))
                .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.markHost(jobId, "h9", HostJobState.OK))
                .isInstanceOf(HostTransitionException.class)
                .hasMessageContaining("not part of job");
        assertThat(store.getJob("missing")).isEmpty();
    }

    @Test
    void jobWithoutHostsCompletesOnStart() {
        String jobId = store.createJob(ScopeKey.of(ScopeName.VMS, List.of())).getJobId();

        JobStatus job = store.startJob(jobId);

        assertThat(job.getStatus()).isEqualTo(JobState.DONE);
        assertThat(job.getProgress().getTotalHosts()).isZero();
    }

    @Test
    void readsAreCopies() {
        String jobId = store.createJob(key).getJobId();

        store.getJob(jobId).orElseThrow().getHostsStatus().get("h1").setState(HostJobState.OK);

        assertThat(store.getJob(jobId).orElseThrow().getHostsStatus().get("h1").getState())
                .isEqualTo(HostJobState.PENDING);
    }

    @Test
    void heartbeatAndResultAreRecorded() {
        String jobId = store.createJob(key).getJobId();
        clock.advance(Duration.ofSeconds(30));

        store.heartbeat(jobId);
        JobStatus job = store.attachResult(jobId, key.asString(), "partial");

        assertThat(job.getLastHeartbeatAt()).isEqualTo(T0.plusSeconds(30));
        assertThat(job.getSnapshotKey()).isEqualTo("vms:h1,h2,h3:summary");
        assertThat(job.getMessage()).isEqualTo("partial");
    }

    @Test
    void finishedJobsArePrunedFirstWhenFull() {
        JobStore small = new JobStore(clock, 2, Duration.ofHours(24));
        ScopeKey one = ScopeKey.of(ScopeName.VMS, List.of("a"));
        String finished = small.createJob(one).getJobId();
        small.markHost(finished, "a", HostJobState.OK);
        String running = small.createJob(ScopeKey.of(ScopeName.VMS, List.of("b"))).getJobId();

        String third = small.createJob(ScopeKey.of(ScopeName.VMS, List.of("c"))).getJobId();

        assertThat(small.getJob(finished)).isEmpty();
        assertThat(small.getJob(running)).isPresent();
        assertThat(small.getJob(third)).isPresent();
        assertThat(small.size()).isEqualTo(2);
    }
}
