package net.jobclaim.core.model;

import java.time.Instant;

public record Job(
        Long id,
        String name,
        String executor,
        String expression,   // cron (Quartz)
        String config,       // executor payload, opaque to the core
        JobStatus status,
        long version,
        Instant nextDueAt,
        Instant createdAt,
        Instant updatedAt
) {
    public boolean dueAt(Instant now) {
        return status == JobStatus.WAITING && nextDueAt.isBefore(now);
    }

    /** 조건부 업데이트가 성공한 뒤의 행 */
    public Job after(JobUpdate u) {
        return new Job(id, name, executor, expression, config,
                u.status() == null ? status : u.status(),
                version + 1,
                u.nextDueAt() == null ? nextDueAt : u.nextDueAt(),
                createdAt,
                u.updatedAt());
    }
}
