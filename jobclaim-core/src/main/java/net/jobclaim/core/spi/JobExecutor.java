package net.jobclaim.core.spi;

import net.jobclaim.core.model.ExecutionContext;
import net.jobclaim.core.model.ExecutionResult;

/**
 * 실제 작업. {@link #id()} 가 TB_JOB.EXECUTOR 와 매칭된다.
 * 예외를 던지면 실패 결과와 같게 취급한다.
 */
public interface JobExecutor {
    String id();

    ExecutionResult execute(ExecutionContext ctx) throws Exception;
}
