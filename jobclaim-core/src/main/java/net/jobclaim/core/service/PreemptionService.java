package net.jobclaim.core.service;

import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobUpdate;
import net.jobclaim.core.spi.JobRepository;
import net.jobclaim.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * due Job 하나를 VERSION CAS 로 선점한다.
 * <p>
 * 같은 후보를 여럿이 읽어도 (id, version) 조건부 업데이트는 하나만 성공한다.
 * 진 쪽은 다시 읽어서 다른 후보를 잡거나, 없으면 NOT_FOUND, maxAttempts 를 넘기면 CONTENTION.
 */
public final class PreemptionService {
    private static final Logger log = LoggerFactory.getLogger(PreemptionService.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final RetryPolicy retry;
    private final int maxAttempts;

    public PreemptionService(JobRepository jobs, TxRunner tx, RetryPolicy retry, int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.jobs = jobs;
        this.tx = tx;
        this.retry = retry;
        this.maxAttempts = maxAttempts;
    }

    public Claim preempt(Instant now) throws Exception {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<Job> candidate = tx.requiresNew(() -> jobs.findDueCandidate(now));
            if (candidate.isEmpty()) return Claim.notFound(attempt);

            Job job = candidate.get();
            JobUpdate update = JobUpdate.claim(now);
            int rows = tx.requiresNew(() -> jobs.conditionalUpdate(job.id(), job.version(), update));
            if (rows == 1) {
                Job owned = job.after(update);
                log.debug("claimed job id={} name={} version={}", owned.id(), owned.name(), owned.version());
                return Claim.claimed(owned, attempt);
            }

            // 이 (id, version) 은 다른 워커가 가져감
            log.debug("claim conflict on job id={} version={} attempt={}", job.id(), job.version(), attempt);
            if (attempt < maxAttempts) sleep(retry.nextBackoff(attempt));
        }
        log.debug("claim gave up after {} attempts", maxAttempts);
        return Claim.contention(maxAttempts);
    }

    private static void sleep(Duration d) throws InterruptedException {
        if (!d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
    }
}
