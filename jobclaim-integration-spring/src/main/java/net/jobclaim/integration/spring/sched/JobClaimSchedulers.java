package net.jobclaim.integration.spring.sched;

import net.jobclaim.core.maintenance.MaintenanceService;
import org.springframework.scheduling.annotation.Scheduled;

/** 워커 루프와 별개로 도는 주기 작업. 지금은 만료 lease 회수 하나뿐이다. */
public class JobClaimSchedulers {
    private final MaintenanceService maintenance;

    public JobClaimSchedulers(MaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${jobclaim.scheduler.maintenance-delay-ms:10000}")
    public void maintenance() throws Exception {
        maintenance.runOnce();
    }
}
