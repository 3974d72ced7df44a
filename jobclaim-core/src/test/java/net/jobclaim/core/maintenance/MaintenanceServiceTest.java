package net.jobclaim.core.maintenance;

import net.jobclaim.core.lease.LeaseService;
import net.jobclaim.core.model.JobStatus;
import net.jobclaim.core.service.PreemptionService;
import net.jobclaim.core.service.RetryPolicy;
import net.jobclaim.core.spi.SchedulerListener;
import net.jobclaim.core.support.DirectTxRunner;
import net.jobclaim.core.support.InMemoryJobRepository;
import net.jobclaim.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static net.jobclaim.core.support.InMemoryJobRepository.waiting;
import static org.junit.jupiter.api.Assertions.*;

class MaintenanceServiceTest {

    static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void runOnce_reclaimsOnlyLeasesPastTheTimeout() throws Exception {
        InMemoryJobRepository jobs = new InMemoryJobRepository();
        DirectTxRunner tx = new DirectTxRunner();
        MutableClock clock = new MutableClock(T0.plusMillis(1));
        PreemptionService preemption = new PreemptionService(jobs, tx, RetryPolicy.fixed(Duration.ZERO), 3);
        AtomicInteger reported = new AtomicInteger(-1);
        SchedulerListener listener = new SchedulerListener() {
            @Override public void onStaleLeasesReclaimed(int count) { reported.set(count); }
        };
        MaintenanceService maintenance = new MaintenanceService(new LeaseService(jobs, tx), clock, listener,
                Duration.ofSeconds(30));

        jobs.put(waiting(1, "dead", 5, T0));
        jobs.put(waiting(2, "alive", 5, T0));
        assertTrue(preemption.preempt(clock.now()).claimed());      // id 1
        clock.advance(Duration.ofSeconds(20));
        assertTrue(preemption.preempt(clock.now()).claimed());      // id 2, 20초 늦게

        clock.advance(Duration.ofSeconds(15));
        MaintenanceService.MaintenanceReport report = maintenance.runOnce();

        assertEquals(1, report.reclaimedLeases);
        assertEquals(1, reported.get());
        assertEquals(clock.now(), report.timestamp);
        assertEquals(JobStatus.WAITING, jobs.get(1).status());
        assertEquals(7, jobs.get(1).version());
        assertEquals(JobStatus.RUNNING, jobs.get(2).status());
    }
}
