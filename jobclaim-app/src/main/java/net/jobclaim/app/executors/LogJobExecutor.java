package net.jobclaim.app.executors;

import net.jobclaim.core.model.ExecutionContext;
import net.jobclaim.core.model.ExecutionResult;
import net.jobclaim.core.spi.Clock;
import net.jobclaim.core.spi.JobExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;


/** CONFIG 를 그대로 로그로 남긴다. 배포 확인용. */
@Component
public class LogJobExecutor implements JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(LogJobExecutor.class);

    private final Clock clock;

    public LogJobExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String id() {
        return "log";
    }

    @Override
    public ExecutionResult execute(ExecutionContext ctx) {
        log.info("[{}] scheduledAt={} config={}", ctx.jobName(), ctx.scheduledAt(), ctx.config());
        return ExecutionResult.success(clock.now());
    }
}
