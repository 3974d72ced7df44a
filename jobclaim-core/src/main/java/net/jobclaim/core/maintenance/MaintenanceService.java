package net.jobclaim.core.maintenance;

import net.jobclaim.core.lease.LeaseService;
import net.jobclaim.core.spi.Clock;
import net.jobclaim.core.spi.SchedulerListener;

import java.time.Duration;
import java.time.Instant;

/** 워커 생명주기와 별개의 타이머에서 호출된다. 원래 소유자가 모두 죽어도 회수는 계속된다. */
public final class MaintenanceService {
    private final LeaseService leases;
    private final Clock clock;
    private final SchedulerListener listener;
    private final Duration leaseTimeout;

    public MaintenanceService(LeaseService leases, Clock clock, SchedulerListener listener, Duration leaseTimeout) {
        this.leases = leases;
        this.clock = clock;
        this.listener = listener;
        this.leaseTimeout = leaseTimeout;
    }

    /**
     * 주기 점검 메인 루틴.
     * - RUNNING 인데 하트비트가 leaseTimeout 넘게 끊긴 Job → WAITING (VERSION+1)
     */
    public MaintenanceReport runOnce() throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();
        r.reclaimedLeases = leases.reclaimStale(now, leaseTimeout);
        listener.onStaleLeasesReclaimed(r.reclaimedLeases);
        r.timestamp = now;
        return r;
    }

    public Duration leaseTimeout() { return leaseTimeout; }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int reclaimedLeases;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", reclaimedLeases=" + reclaimedLeases +
                    '}';
        }
    }
}
