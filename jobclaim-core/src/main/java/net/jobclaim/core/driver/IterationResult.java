package net.jobclaim.core.driver;

import net.jobclaim.core.lease.ReleaseResult;
import net.jobclaim.core.model.ExecutionResult;
import net.jobclaim.core.model.Job;

/** 드라이버 한 바퀴의 결과 */
public record IterationResult(
        Outcome outcome,
        Job job,                    // 선점한 Job (EXECUTED 때만)
        ExecutionResult execution,
        ReleaseResult release,      // 저장소 오류로 반납을 못 했으면 null
        boolean scheduleFailed
) {
    public enum Outcome { NOT_FOUND, CONTENTION, STORE_ERROR, EXECUTED }

    static IterationResult idle(Outcome outcome) {
        return new IterationResult(outcome, null, null, null, false);
    }

    static IterationResult executed(Job job, ExecutionResult execution, ReleaseResult release, boolean scheduleFailed) {
        return new IterationResult(Outcome.EXECUTED, job, execution, release, scheduleFailed);
    }

    /**
     * 다음 바퀴 전에 쉬어야 하는가.
     * 스케줄 계산에 실패한 Job 은 due 가 그대로라 곧바로 다시 선점되므로 쉬어 간다.
     */
    public boolean shouldBackOff() {
        return outcome != Outcome.EXECUTED || release == null || scheduleFailed;
    }
}
