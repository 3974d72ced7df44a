package net.jobclaim.core.driver;

import net.jobclaim.core.error.ScheduleEvaluationException;
import net.jobclaim.core.lease.HeartbeatResult;
import net.jobclaim.core.lease.Lease;
import net.jobclaim.core.lease.LeaseService;
import net.jobclaim.core.lease.ReleaseResult;
import net.jobclaim.core.model.ExecutionContext;
import net.jobclaim.core.model.ExecutionResult;
import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobUpdate;
import net.jobclaim.core.service.Claim;
import net.jobclaim.core.service.PreemptionService;
import net.jobclaim.core.spi.Clock;
import net.jobclaim.core.spi.CronCalculator;
import net.jobclaim.core.spi.JobExecutor;
import net.jobclaim.core.spi.SchedulerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 워커 하나의 루프: 선점 → 실행(+하트비트) → 다음 due 계산 → 반납.
 * <p>
 * 실행 실패도 스케줄은 전진한다. 재시도 정책은 executor 몫이다.
 * 반납 CAS가 거절되면(이미 회수됨) 조용히 버린다.
 */
public final class SchedulerDriver implements Runnable, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerDriver.class);

    private final String name;
    private final PreemptionService preemption;
    private final LeaseService leases;
    private final ExecutorRegistry executors;
    private final CronCalculator cron;
    private final Clock clock;
    private final SchedulerListener listener;
    private final DriverSettings settings;

    private final ExecutorService executionPool;
    private final ScheduledExecutorService heartbeatTimer;

    private volatile DriverState state = DriverState.IDLE;
    private volatile boolean running;

    public SchedulerDriver(String name,
                           PreemptionService preemption,
                           LeaseService leases,
                           ExecutorRegistry executors,
                           CronCalculator cron,
                           Clock clock,
                           SchedulerListener listener,
                           DriverSettings settings) {
        this.name = name;
        this.preemption = preemption;
        this.leases = leases;
        this.executors = executors;
        this.cron = cron;
        this.clock = clock;
        this.listener = listener;
        this.settings = settings;
        this.executionPool = Executors.newCachedThreadPool(r -> daemon(r, name + "-exec"));
        this.heartbeatTimer = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, name + "-heartbeat"));
    }

    public String name() { return name; }

    public DriverState state() { return state; }

    @Override
    public void run() {
        running = true;
        log.info("worker {} started", name);
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                IterationResult r = runOnce();
                if (r.shouldBackOff() && !settings.idleBackoff().isZero()) {
                    Thread.sleep(settings.idleBackoff().toMillis());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running = false;
            state = DriverState.STOPPED;
            log.info("worker {} stopped", name);
        }
    }

    public void stop() {
        running = false;
    }

    /** 한 바퀴. 예외를 던지지 않는다. */
    public IterationResult runOnce() {
        state = DriverState.CLAIMING;
        Claim claim;
        try {
            claim = preemption.preempt(clock.now());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state = DriverState.IDLE;
            return IterationResult.idle(IterationResult.Outcome.CONTENTION);
        } catch (Exception e) {
            listener.onPersistenceFailure("claim", e);
            state = DriverState.IDLE;
            return IterationResult.idle(IterationResult.Outcome.STORE_ERROR);
        }
        if (!claim.claimed()) {
            state = DriverState.IDLE;
            return IterationResult.idle(claim.outcome() == Claim.Outcome.NOT_FOUND
                    ? IterationResult.Outcome.NOT_FOUND
                    : IterationResult.Outcome.CONTENTION);
        }

        Job job = claim.job();
        Lease lease = leases.open(job);

        state = DriverState.EXECUTING;
        boolean interrupted = false;
        ExecutionResult result;
        try {
            result = execute(job, lease);
        } catch (InterruptedException e) {
            interrupted = true;
            result = ExecutionResult.failure("worker interrupted", clock.now());
        }
        listener.onRunCompleted(job, result);

        state = DriverState.RESCHEDULING;
        IterationResult out = rescheduleAndRelease(job, lease, result);
        state = DriverState.IDLE;
        if (interrupted) Thread.currentThread().interrupt();
        return out;
    }

    private ExecutionResult execute(Job job, Lease lease) throws InterruptedException {
        ExecutionContext ctx = ExecutionContext.of(job, clock.now());
        Optional<JobExecutor> executor = executors.find(job.executor());
        if (executor.isEmpty()) {
            log.warn("no executor registered for '{}' (job='{}')", job.executor(), job.name());
            return ExecutionResult.failure("unknown executor: " + job.executor(), clock.now());
        }

        Future<ExecutionResult> run = executionPool.submit(() -> executor.get().execute(ctx));
        long beatMs = settings.heartbeatInterval().toMillis();
        ScheduledFuture<?> ticker = heartbeatTimer.scheduleAtFixedRate(
                () -> beat(lease, ctx, run), beatMs, beatMs, TimeUnit.MILLISECONDS);
        try {
            ExecutionResult r = run.get(settings.executionTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return r != null ? r : ExecutionResult.failure("executor returned no result", clock.now());
        } catch (TimeoutException e) {
            ctx.cancel();
            run.cancel(true);
            return ExecutionResult.failure("timed out after " + settings.executionTimeout(), clock.now());
        } catch (CancellationException e) {
            return ExecutionResult.failure("cancelled: lease lost", clock.now());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("executor '{}' threw for job='{}'", job.executor(), job.name(), cause);
            return ExecutionResult.failure(cause.toString(), clock.now());
        } catch (InterruptedException e) {
            ctx.cancel();
            run.cancel(true);
            throw e;
        } finally {
            ticker.cancel(false);
        }
    }

    private void beat(Lease lease, ExecutionContext ctx, Future<?> run) {
        try {
            // 반납과 겹친 마지막 틱은 NOT_OWNER 여도 isLost() 가 아니다
            if (leases.heartbeat(lease, clock.now()) == HeartbeatResult.NOT_OWNER && lease.isLost()) {
                listener.onLeaseLost(lease.job());
                ctx.cancel();
                run.cancel(true);
            }
        } catch (Exception e) {
            // 다음 틱에서 다시 시도. 계속 실패하면 회수 스캔이 정리한다
            listener.onPersistenceFailure("heartbeat", e);
        }
    }

    private IterationResult rescheduleAndRelease(Job job, Lease lease, ExecutionResult result) {
        Instant now = clock.now();
        JobUpdate update;
        boolean scheduleFailed = false;
        try {
            update = JobUpdate.release(nextDue(job, now), now);
        } catch (ScheduleEvaluationException e) {
            // NEXT_DUE_AT 은 그대로 두고 WAITING 으로만 돌린다
            scheduleFailed = true;
            listener.onScheduleEvaluationFailed(job, e);
            update = JobUpdate.reclaim(now);
        }

        try {
            ReleaseResult released = leases.release(lease, update);
            if (released == ReleaseResult.LOST) {
                log.debug("release dropped, lease already reclaimed: job id={}", job.id());
            }
            return IterationResult.executed(job, result, released, scheduleFailed);
        } catch (Exception e) {
            listener.onPersistenceFailure("release", e);
            return IterationResult.executed(job, result, null, scheduleFailed);
        }
    }

    Instant nextDue(Job job, Instant now) throws ScheduleEvaluationException {
        Instant next;
        try {
            next = cron.next(now, job.expression(), settings.zone());
        } catch (RuntimeException e) {
            throw new ScheduleEvaluationException(job.expression(), "cannot evaluate: " + e.getMessage(), e);
        }
        if (next == null || !next.isAfter(now)) {
            throw new ScheduleEvaluationException(job.expression(), "no due time after " + now + " (got " + next + ")");
        }
        return next;
    }

    @Override
    public void close() {
        running = false;
        heartbeatTimer.shutdownNow();
        executionPool.shutdownNow();
    }

    private static Thread daemon(Runnable r, String threadName) {
        Thread t = new Thread(r, threadName);
        t.setDaemon(true);
        return t;
    }
}
