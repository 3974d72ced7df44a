package net.jobclaim.adapter.jdbc;

import net.jobclaim.adapter.jdbc.repo.JdbcJobRepository;
import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobStatus;
import net.jobclaim.core.service.Claim;
import net.jobclaim.core.service.PreemptionService;
import net.jobclaim.core.service.RetryPolicy;
import net.jobclaim.core.spi.JobRepository;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 병렬 경합 인수 테스트
 * - 같은 (id, VERSION) 에 대한 CAS 는 하나만 성공해야 한다
 * - 여러 due Job 을 여러 스레드가 나눠 가져도 중복 선점이 없어야 한다
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class ConcurrentPreemptionAcceptanceTest extends TestSupport {

    static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    JobRepository jobs;
    PreemptionService preemption;

    @BeforeAll
    void initAll() {
        jobs = new JdbcJobRepository();
        preemption = new PreemptionService(jobs, tx,
                RetryPolicy.exponentialJitter(Duration.ofMillis(1), Duration.ofMillis(20)), 20);
    }

    // ========== t1: due Job 1건 경합, 한 스레드만 선점 ==========
    @Test
    void t1_concurrentPreempt_onOneDueJob_exactlyOneWins() throws Exception {
        long id = seedWaiting("demo", 5, T0);
        Instant now = T0.plusMillis(1);

        int threads = 8;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Claim>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                return preemption.preempt(now);
            }));
        }
        start.countDown();

        int wins = 0;
        for (Future<Claim> f : futures) {
            Claim c = f.get(30, TimeUnit.SECONDS);
            if (c.claimed()) {
                wins++;
                assertEquals(6, c.job().version());
                assertEquals(JobStatus.RUNNING, c.job().status());
            } else {
                assertTrue(c.outcome() == Claim.Outcome.NOT_FOUND || c.outcome() == Claim.Outcome.CONTENTION);
            }
        }
        es.shutdown();
        assertEquals(1, wins, "exactly one thread should win the claim");

        Job row = tx.required(() -> jobs.findById(id)).orElseThrow();
        assertEquals(6, row.version());
        assertEquals(JobStatus.RUNNING, row.status());
    }

    // ========== t2: due Job 10건을 8스레드가 분산 선점, 중복 없이 정확히 10건 ==========
    @Test
    void t2_parallelPreempt_distributesWithoutDuplication() throws Exception {
        for (int i = 0; i < 10; i++) seedWaiting("job-" + i, 0, T0.minusSeconds(i));
        Instant now = T0.plusSeconds(1);

        ExecutorService es = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        Set<Long> claimedIds = ConcurrentHashMap.newKeySet();
        AtomicInteger totalClaims = new AtomicInteger();

        Runnable worker = () -> {
            try {
                start.await();
                while (true) {
                    Claim c = preemption.preempt(now);
                    if (c.outcome() == Claim.Outcome.NOT_FOUND) break;
                    if (c.claimed()) {
                        claimedIds.add(c.job().id());
                        totalClaims.incrementAndGet();
                    }
                }
            } catch (Exception e) {
                throw new RuntimeException(e);
            }
        };

        for (int i = 0; i < 8; i++) es.submit(worker);
        start.countDown();
        es.shutdown();
        assertTrue(es.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(10, claimedIds.size(), "all 10 claimed");
        assertEquals(10, totalClaims.get(), "no job claimed twice");
        List<Job> all = tx.required(jobs::findAll);
        assertEquals(10, all.stream().filter(j -> j.status() == JobStatus.RUNNING).count());
        assertTrue(all.stream().allMatch(j -> j.version() == 1));
    }
}
