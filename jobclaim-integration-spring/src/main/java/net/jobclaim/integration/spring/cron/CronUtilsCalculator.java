package net.jobclaim.integration.spring.cron;

import net.jobclaim.core.error.ScheduleEvaluationException;
import net.jobclaim.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

/** 코어 SPI 구현체 */
public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) throws ScheduleEvaluationException {
        return CronSlotPlanner.nextAfter(cronExpr, zone, from);
    }
}
