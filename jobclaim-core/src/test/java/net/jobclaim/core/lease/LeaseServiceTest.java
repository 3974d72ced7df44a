package net.jobclaim.core.lease;

import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobStatus;
import net.jobclaim.core.model.JobUpdate;
import net.jobclaim.core.service.Claim;
import net.jobclaim.core.service.PreemptionService;
import net.jobclaim.core.service.RetryPolicy;
import net.jobclaim.core.support.DirectTxRunner;
import net.jobclaim.core.support.InMemoryJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static net.jobclaim.core.support.InMemoryJobRepository.waiting;
import static org.junit.jupiter.api.Assertions.*;

class LeaseServiceTest {

    static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    static final Duration TIMEOUT = Duration.ofSeconds(30);

    InMemoryJobRepository jobs;
    PreemptionService preemption;
    LeaseService leases;

    @BeforeEach
    void setUp() {
        jobs = new InMemoryJobRepository();
        DirectTxRunner tx = new DirectTxRunner();
        preemption = new PreemptionService(jobs, tx, RetryPolicy.fixed(Duration.ZERO), 3);
        leases = new LeaseService(jobs, tx);
    }

    private Lease claimAt(Instant now) throws Exception {
        Claim c = preemption.preempt(now);
        assertTrue(c.claimed());
        return leases.open(c.job());
    }

    @Test
    void heartbeat_refreshesUpdatedAt_andAdvancesVersion() throws Exception {
        jobs.put(waiting(1, "a", 5, T0));
        Lease lease = claimAt(T0.plusMillis(1));

        assertEquals(HeartbeatResult.OK, leases.heartbeat(lease, T0.plusSeconds(10)));
        assertEquals(HeartbeatResult.OK, leases.heartbeat(lease, T0.plusSeconds(20)));

        Job row = jobs.get(1);
        assertEquals(8, row.version());
        assertEquals(8, lease.version());
        assertEquals(T0.plusSeconds(20), row.updatedAt());
        assertEquals(JobStatus.RUNNING, row.status());
    }

    @Test
    void staleLease_isReclaimedOnce_andClaimableAgain() throws Exception {
        jobs.put(waiting(1, "a", 5, T0));
        Instant claimedAt = T0.plusMillis(1);
        claimAt(claimedAt);

        // 경계: 정확히 timeout 만큼 지난 건 아직 살아있다
        assertEquals(0, leases.reclaimStale(claimedAt.plus(TIMEOUT), TIMEOUT));

        Instant scan = claimedAt.plus(TIMEOUT).plusMillis(1);
        assertEquals(1, leases.reclaimStale(scan, TIMEOUT));
        assertEquals(0, leases.reclaimStale(scan, TIMEOUT));

        Job row = jobs.get(1);
        assertEquals(JobStatus.WAITING, row.status());
        assertEquals(7, row.version());
        assertEquals(T0, row.nextDueAt());

        Claim again = preemption.preempt(scan);
        assertTrue(again.claimed());
        assertEquals(8, again.job().version());
    }

    @Test
    void heartbeatFromTheOldOwner_afterReclaim_failsWithoutWriting() throws Exception {
        jobs.put(waiting(1, "a", 5, T0));
        Lease lease = claimAt(T0.plusMillis(1));
        Instant scan = T0.plus(TIMEOUT).plusSeconds(1);
        assertEquals(1, leases.reclaimStale(scan, TIMEOUT));
        Job afterReclaim = jobs.get(1);

        assertEquals(HeartbeatResult.NOT_OWNER, leases.heartbeat(lease, scan.plusSeconds(1)));
        assertTrue(lease.isLost());
        assertEquals(afterReclaim, jobs.get(1));

        // 한번 잃은 lease 는 다시 쓰지 않는다
        assertEquals(HeartbeatResult.NOT_OWNER, leases.heartbeat(lease, scan.plusSeconds(2)));
        assertEquals(afterReclaim, jobs.get(1));
    }

    @Test
    void releaseAfterReclaim_isDropped() throws Exception {
        jobs.put(waiting(1, "a", 5, T0));
        Lease lease = claimAt(T0.plusMillis(1));
        Instant scan = T0.plus(TIMEOUT).plusSeconds(1);
        leases.reclaimStale(scan, TIMEOUT);
        Job afterReclaim = jobs.get(1);

        ReleaseResult r = leases.release(lease, JobUpdate.release(T0.plusSeconds(3600), scan.plusSeconds(1)));

        assertEquals(ReleaseResult.LOST, r);
        assertEquals(afterReclaim, jobs.get(1));
    }

    @Test
    void release_writesStatusDueTimeAndVersionTogether() throws Exception {
        jobs.put(waiting(1, "a", 5, T0));
        Lease lease = claimAt(T0.plusMillis(1));
        Instant done = T0.plusSeconds(5);

        assertEquals(ReleaseResult.RELEASED, leases.release(lease, JobUpdate.release(T0.plusSeconds(3600), done)));

        Job row = jobs.get(1);
        assertEquals(JobStatus.WAITING, row.status());
        assertEquals(7, row.version());
        assertEquals(T0.plusSeconds(3600), row.nextDueAt());
        assertEquals(done, row.updatedAt());

        // 반납 후의 하트비트/재반납은 아무것도 쓰지 않는다
        assertEquals(HeartbeatResult.NOT_OWNER, leases.heartbeat(lease, done.plusSeconds(1)));
        assertEquals(ReleaseResult.LOST, leases.release(lease, JobUpdate.release(T0.plusSeconds(7200), done)));
        assertEquals(row, jobs.get(1));
    }

    @Test
    void liveHeartbeat_beatsTheReclaimScan() throws Exception {
        jobs.put(waiting(1, "a", 5, T0));
        Lease lease = claimAt(T0.plusMillis(1));
        Instant late = T0.plus(TIMEOUT).plusSeconds(5);

        // 하트비트가 스캔보다 먼저 커밋되면 스캔의 CAS 는 진다
        InMemoryJobRepository racing = new InMemoryJobRepository() {
            @Override
            public synchronized java.util.List<Job> findStale(Instant threshold) {
                var stale = jobs.findStale(threshold);
                try {
                    leases.heartbeat(lease, late);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
                return stale;
            }

            @Override
            public synchronized int conditionalUpdate(long id, long expectedVersion, JobUpdate update) {
                return jobs.conditionalUpdate(id, expectedVersion, update);
            }
        };
        LeaseService scanner = new LeaseService(racing, new DirectTxRunner());

        assertEquals(0, scanner.reclaimStale(late, TIMEOUT));
        assertEquals(JobStatus.RUNNING, jobs.get(1).status());
        assertEquals(7, jobs.get(1).version());
        assertFalse(lease.isLost());
    }
}
