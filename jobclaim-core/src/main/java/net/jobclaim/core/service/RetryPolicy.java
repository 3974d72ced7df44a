package net.jobclaim.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** attempt(1부터) 실패 후 다음 시도 전 대기 */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    static RetryPolicy exponentialJitter(Duration base, Duration max) {
        return new JitteredRetryPolicy(base, max);
    }
}
