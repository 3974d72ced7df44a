package net.jobclaim.core.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** 지수 백오프 + full jitter: [0, min(max, base * 2^(attempt-1))] 균등 분포 */
final class JitteredRetryPolicy implements RetryPolicy {
    private final long baseMs;
    private final long maxMs;

    JitteredRetryPolicy(Duration base, Duration max) {
        if (base.isNegative() || max.isNegative()) throw new IllegalArgumentException("negative backoff");
        this.baseMs = base.toMillis();
        this.maxMs = Math.max(baseMs, max.toMillis());
    }

    @Override
    public Duration nextBackoff(long attempt) {
        if (baseMs == 0) return Duration.ZERO;
        int shift = (int) Math.min(Math.max(attempt - 1, 0), 30);
        long ceiling = Math.min(maxMs, baseMs << shift);
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(ceiling + 1));
    }
}
