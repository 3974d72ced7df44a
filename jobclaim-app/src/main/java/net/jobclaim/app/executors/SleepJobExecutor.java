package net.jobclaim.app.executors;

import net.jobclaim.core.model.ExecutionContext;
import net.jobclaim.core.model.ExecutionResult;
import net.jobclaim.core.spi.Clock;
import net.jobclaim.core.spi.JobExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * CONFIG 의 밀리초만큼 잠든다. 하트비트가 lease 를 유지하는지 볼 때 쓴다.
 * 취소(타임아웃, lease 상실)되면 바로 실패로 끝난다.
 */
@Component
public class SleepJobExecutor implements JobExecutor {
    private final Clock clock;

    public SleepJobExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String id() {
        return "sleep";
    }

    @Override
    public ExecutionResult execute(ExecutionContext ctx) throws InterruptedException {
        long ms = parseMillis(ctx.config());
        long deadline = System.nanoTime() + Duration.ofMillis(ms).toNanos();
        while (System.nanoTime() < deadline) {
            if (ctx.cancelled()) return ExecutionResult.failure("cancelled", clock.now());
            Thread.sleep(Math.min(100, Math.max(1, (deadline - System.nanoTime()) / 1_000_000)));
        }
        return ExecutionResult.success(clock.now());
    }

    static long parseMillis(String config) {
        if (config == null || config.isBlank()) return 1000;
        try {
            return Long.parseLong(config.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("sleep executor expects milliseconds, got: " + config, e);
        }
    }
}
