package net.jobclaim.core.spi;

import net.jobclaim.core.error.ScheduleEvaluationException;
import net.jobclaim.core.model.ExecutionResult;
import net.jobclaim.core.model.Job;

/** 운영 알림 훅. 구현체는 예외를 던지면 안 된다 */
public interface SchedulerListener {
    default void onRunCompleted(Job job, ExecutionResult result) {}
    default void onScheduleEvaluationFailed(Job job, ScheduleEvaluationException e) {}
    default void onPersistenceFailure(String phase, Exception e) {}
    default void onLeaseLost(Job job) {}
    default void onStaleLeasesReclaimed(int count) {}
}
