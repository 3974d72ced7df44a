package net.jobclaim.core.driver;

import net.jobclaim.core.error.ScheduleEvaluationException;
import net.jobclaim.core.model.ExecutionResult;
import net.jobclaim.core.model.Job;
import net.jobclaim.core.spi.SchedulerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingSchedulerListener implements SchedulerListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingSchedulerListener.class);

    @Override
    public void onRunCompleted(Job job, ExecutionResult result) {
        if (result.success()) {
            log.debug("run succeeded: job='{}' id={}", job.name(), job.id());
        } else {
            log.warn("run failed: job='{}' id={} reason={}", job.name(), job.id(), result.message());
        }
    }

    @Override
    public void onScheduleEvaluationFailed(Job job, ScheduleEvaluationException e) {
        log.error("cannot compute next due time, operator action required: job='{}' id={} expression='{}'",
                job.name(), job.id(), e.getExpression(), e);
    }

    @Override
    public void onPersistenceFailure(String phase, Exception e) {
        log.warn("job store failure during {}", phase, e);
    }

    @Override
    public void onLeaseLost(Job job) {
        log.warn("lease lost while running: job='{}' id={}", job.name(), job.id());
    }

    @Override
    public void onStaleLeasesReclaimed(int count) {
        if (count > 0) log.info("reclaimed {} stale lease(s)", count);
    }
}
