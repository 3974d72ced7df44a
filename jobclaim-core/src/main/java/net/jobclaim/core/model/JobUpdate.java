package net.jobclaim.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 조건부 업데이트 한 번에 쓰는 필드. VERSION 은 저장소가 항상 +1 한다.
 * status / nextDueAt 이 null 이면 그 컬럼은 그대로 둔다.
 */
public record JobUpdate(JobStatus status, Instant nextDueAt, Instant updatedAt) {

    public JobUpdate {
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static JobUpdate claim(Instant now) {
        return new JobUpdate(JobStatus.RUNNING, null, now);
    }

    public static JobUpdate touch(Instant now) {
        return new JobUpdate(null, null, now);
    }

    public static JobUpdate reclaim(Instant now) {
        return new JobUpdate(JobStatus.WAITING, null, now);
    }

    public static JobUpdate release(Instant nextDueAt, Instant now) {
        return new JobUpdate(JobStatus.WAITING, nextDueAt, now);
    }
}
