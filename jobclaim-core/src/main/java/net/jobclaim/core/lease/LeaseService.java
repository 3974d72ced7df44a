package net.jobclaim.core.lease;

import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobUpdate;
import net.jobclaim.core.spi.JobRepository;
import net.jobclaim.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** 하트비트 / 반납 / 만료 lease 회수. 모든 쓰기는 VERSION 조건부 업데이트 한 번이다. */
public final class LeaseService {
    private static final Logger log = LoggerFactory.getLogger(LeaseService.class);

    private final JobRepository jobs;
    private final TxRunner tx;

    public LeaseService(JobRepository jobs, TxRunner tx) {
        this.jobs = jobs;
        this.tx = tx;
    }

    public Lease open(Job claimed) {
        return new Lease(claimed);
    }

    /** UPDATED_AT 갱신(VERSION+1). 다른 쪽이 먼저 VERSION을 바꿨으면 NOT_OWNER, 행은 그대로. */
    public HeartbeatResult heartbeat(Lease lease, Instant now) throws Exception {
        lease.lock().lock();
        try {
            if (lease.inactive()) return HeartbeatResult.NOT_OWNER;
            Job current = lease.job();
            JobUpdate update = JobUpdate.touch(now);
            int rows = tx.requiresNew(() -> jobs.conditionalUpdate(current.id(), current.version(), update));
            if (rows == 0) {
                lease.markLost();
                log.warn("heartbeat rejected, lease lost: job id={} version={}", current.id(), current.version());
                return HeartbeatResult.NOT_OWNER;
            }
            lease.advance(current.after(update));
            return HeartbeatResult.OK;
        } finally {
            lease.lock().unlock();
        }
    }

    /** 마지막 전이(RUNNING -> WAITING). 이미 회수된 lease면 LOST, 아무것도 쓰지 않는다. */
    public ReleaseResult release(Lease lease, JobUpdate update) throws Exception {
        lease.lock().lock();
        try {
            if (lease.inactive()) return ReleaseResult.LOST;
            Job current = lease.job();
            int rows = tx.requiresNew(() -> jobs.conditionalUpdate(current.id(), current.version(), update));
            lease.markClosed();
            if (rows == 0) {
                lease.markLost();
                return ReleaseResult.LOST;
            }
            lease.advance(current.after(update));
            return ReleaseResult.RELEASED;
        } finally {
            lease.lock().unlock();
        }
    }

    /**
     * UPDATED_AT이 now - leaseTimeout 보다 오래된 RUNNING을 WAITING으로 되돌린다.
     * 스캔 시점의 VERSION으로 CAS 하므로 살아있는 워커의 하트비트와 경합하면 한쪽만 이긴다.
     */
    public int reclaimStale(Instant now, Duration leaseTimeout) throws Exception {
        Instant threshold = now.minus(leaseTimeout);
        List<Job> stale = tx.requiresNew(() -> jobs.findStale(threshold));
        int reclaimed = 0;
        for (Job j : stale) {
            int rows = tx.requiresNew(() -> jobs.conditionalUpdate(j.id(), j.version(), JobUpdate.reclaim(now)));
            if (rows == 1) {
                reclaimed++;
                log.info("reclaimed stale lease: job id={} name={} lastHeartbeat={}", j.id(), j.name(), j.updatedAt());
            }
        }
        return reclaimed;
    }
}
