package net.jobclaim.core.spi;

import net.jobclaim.core.error.ScheduleEvaluationException;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    /** from 보다 엄격히 뒤인 첫 실행 시각 */
    Instant next(Instant from, String cronExpr, ZoneId zone) throws ScheduleEvaluationException;
}
