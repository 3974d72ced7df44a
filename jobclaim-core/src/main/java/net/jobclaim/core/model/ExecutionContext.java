package net.jobclaim.core.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/** 실행 1회 입력. 오래 걸리는 executor 는 {@link #cancelled()} 를 확인할 것 */
public final class ExecutionContext {
    private final long jobId;
    private final String jobName;
    private final String config;
    private final Instant scheduledAt;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ExecutionContext(long jobId, String jobName, String config, Instant scheduledAt, Instant startedAt) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.config = config;
        this.scheduledAt = scheduledAt;
        this.startedAt = startedAt;
    }

    public static ExecutionContext of(Job job, Instant startedAt) {
        return new ExecutionContext(job.id(), job.name(), job.config(), job.nextDueAt(), startedAt);
    }

    public long jobId() { return jobId; }
    public String jobName() { return jobName; }
    public String config() { return config; }
    public Instant scheduledAt() { return scheduledAt; }
    public Instant startedAt() { return startedAt; }

    public boolean cancelled() { return cancelled.get(); }
    public void cancel() { cancelled.set(true); }
}
