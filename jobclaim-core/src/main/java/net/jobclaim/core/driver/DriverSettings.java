package net.jobclaim.core.driver;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * @param leaseTimeout      하트비트가 이보다 오래 없으면 회수 대상
 * @param heartbeatInterval leaseTimeout 보다 반드시 짧아야 한다
 * @param executionTimeout  실행 상한. 넘으면 취소 후 실패로 처리
 * @param idleBackoff       NOT_FOUND / CONTENTION / 저장소 오류 후 쉬는 시간
 * @param zone              cron 평가 기준 타임존
 */
public record DriverSettings(
        Duration leaseTimeout,
        Duration heartbeatInterval,
        Duration executionTimeout,
        Duration idleBackoff,
        ZoneId zone
) {
    public DriverSettings {
        Objects.requireNonNull(leaseTimeout, "leaseTimeout");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(executionTimeout, "executionTimeout");
        Objects.requireNonNull(idleBackoff, "idleBackoff");
        Objects.requireNonNull(zone, "zone");
        if (!positive(leaseTimeout) || !positive(heartbeatInterval) || !positive(executionTimeout)) {
            throw new IllegalArgumentException("leaseTimeout, heartbeatInterval and executionTimeout must be positive");
        }
        if (idleBackoff.isNegative()) throw new IllegalArgumentException("idleBackoff must not be negative");
        if (heartbeatInterval.compareTo(leaseTimeout) >= 0) {
            throw new IllegalArgumentException("heartbeatInterval (" + heartbeatInterval
                    + ") must be shorter than leaseTimeout (" + leaseTimeout + ")");
        }
    }

    public static DriverSettings defaults() {
        return new DriverSettings(Duration.ofSeconds(30), Duration.ofSeconds(10),
                Duration.ofMinutes(10), Duration.ofSeconds(1), ZoneId.of("UTC"));
    }

    private static boolean positive(Duration d) {
        return !d.isZero() && !d.isNegative();
    }
}
