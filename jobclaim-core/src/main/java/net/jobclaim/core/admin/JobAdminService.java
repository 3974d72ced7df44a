package net.jobclaim.core.admin;

import net.jobclaim.core.error.ScheduleEvaluationException;
import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobStatus;
import net.jobclaim.core.model.NewJob;
import net.jobclaim.core.spi.Clock;
import net.jobclaim.core.spi.CronCalculator;
import net.jobclaim.core.spi.JobRepository;
import net.jobclaim.core.spi.TxRunner;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * 관리용 CRUD. 선점 프로토콜 밖이지만 상태를 바꾸는 쓰기는 VERSION을 올리므로
 * 진행 중인 선점 CAS와 겹치면 선점 쪽이 진다.
 */
public final class JobAdminService {
    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final CronCalculator cron;
    private final ZoneId zone;

    public JobAdminService(JobRepository jobs, TxRunner tx, Clock clock, CronCalculator cron, ZoneId zone) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.cron = cron;
        this.zone = zone;
    }

    /** nextDueAt 이 null 이면 표현식으로 첫 due 를 계산한다. */
    public Job create(String name, String executor, String expression, String config, Instant nextDueAt)
            throws Exception {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        if (executor == null || executor.isBlank()) throw new IllegalArgumentException("executor is required");
        if (expression == null || expression.isBlank()) throw new IllegalArgumentException("expression is required");

        Instant now = clock.now();
        Instant due = nextDueAt != null ? nextDueAt : firstDue(expression, now);
        return tx.required(() -> jobs.insert(new NewJob(name, executor, expression, config, due), now));
    }

    /** WAITING → PAUSED. RUNNING 이면 false (돌아온 뒤에 다시 요청) */
    public boolean pause(long id) throws Exception {
        return tx.required(() -> jobs.transition(id, JobStatus.WAITING, JobStatus.PAUSED, clock.now())) == 1;
    }

    /** PAUSED → WAITING */
    public boolean resume(long id) throws Exception {
        return tx.required(() -> jobs.transition(id, JobStatus.PAUSED, JobStatus.WAITING, clock.now())) == 1;
    }

    public boolean delete(long id) throws Exception {
        return tx.required(() -> jobs.delete(id)) == 1;
    }

    public Optional<Job> find(long id) throws Exception {
        return tx.required(() -> jobs.findById(id));
    }

    public Optional<Job> findByName(String name) throws Exception {
        return tx.required(() -> jobs.findByName(name));
    }

    public List<Job> list() throws Exception {
        return tx.required(jobs::findAll);
    }

    private Instant firstDue(String expression, Instant now) throws ScheduleEvaluationException {
        Instant next;
        try {
            next = cron.next(now, expression, zone);
        } catch (RuntimeException e) {
            throw new ScheduleEvaluationException(expression, "cannot evaluate: " + e.getMessage(), e);
        }
        if (next == null || !next.isAfter(now)) {
            throw new ScheduleEvaluationException(expression, "no due time after " + now);
        }
        return next;
    }
}
