package net.jobclaim.core.spi;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@FunctionalInterface
public interface Clock {
    Instant now();

    /** TIMESTAMP(3) 정밀도(ms)로 자른 시스템 시각 */
    static Clock system() {
        return () -> Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
