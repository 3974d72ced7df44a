package net.jobclaim.bootstrap.autoconfigure;

import net.jobclaim.bootstrap.catalog.CatalogRegistrar;
import net.jobclaim.bootstrap.props.JobClaimProperties;
import net.jobclaim.core.admin.JobAdminService;
import net.jobclaim.core.driver.DriverSettings;
import net.jobclaim.core.driver.ExecutorRegistry;
import net.jobclaim.core.driver.LoggingSchedulerListener;
import net.jobclaim.core.driver.SchedulerDriver;
import net.jobclaim.core.driver.WorkerPool;
import net.jobclaim.core.lease.LeaseService;
import net.jobclaim.core.maintenance.MaintenanceService;
import net.jobclaim.core.service.PreemptionService;
import net.jobclaim.core.service.RetryPolicy;
import net.jobclaim.core.spi.Clock;
import net.jobclaim.core.spi.CronCalculator;
import net.jobclaim.core.spi.JobExecutor;
import net.jobclaim.core.spi.JobRepository;
import net.jobclaim.core.spi.SchedulerListener;
import net.jobclaim.core.spi.TxRunner;
import net.jobclaim.integration.spring.JobClaimSpringConfig;
import net.jobclaim.integration.spring.cron.CronUtilsCalculator;
import net.jobclaim.integration.spring.sched.JobClaimSchedulers;
import net.jobclaim.integration.spring.worker.WorkerPoolLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(JobClaimProperties.class)
@Import(JobClaimSpringConfig.class) // integration-spring: repo/tx/clock wiring
public class JobClaimAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(JobClaimAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    @Bean
    @ConditionalOnMissingBean(SchedulerListener.class)
    public SchedulerListener schedulerListener() {
        return new LoggingSchedulerListener();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public PreemptionService preemption(JobRepository jobs, TxRunner tx, JobClaimProperties props) {
        var p = props.getPreempt();
        return new PreemptionService(jobs, tx,
                RetryPolicy.exponentialJitter(p.getBaseBackoff(), p.getMaxBackoff()), p.getMaxAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseService leases(JobRepository jobs, TxRunner tx) {
        return new LeaseService(jobs, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(LeaseService leases,
                                          Clock clock,
                                          SchedulerListener listener,
                                          JobClaimProperties props) {
        return new MaintenanceService(leases, clock, listener, props.getLease().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAdminService jobAdmin(JobRepository jobs,
                                    TxRunner tx,
                                    Clock clock,
                                    CronCalculator cron,
                                    JobClaimProperties props) {
        return new JobAdminService(jobs, tx, clock, cron, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutorRegistry executorRegistry(ObjectProvider<JobExecutor> executors) {
        return new ExecutorRegistry(executors.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public DriverSettings driverSettings(JobClaimProperties props) {
        return new DriverSettings(
                props.getLease().getTimeout(),
                props.getLease().getHeartbeatInterval(),
                props.getWorker().getExecutionTimeout(),
                props.getWorker().getIdleBackoff(),
                ZoneId.of(props.getZone()));
    }

    // --- 워커 (프로퍼티로 on/off) ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "jobclaim.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WorkerPool workerPool(PreemptionService preemption,
                                 LeaseService leases,
                                 ExecutorRegistry executors,
                                 CronCalculator cron,
                                 Clock clock,
                                 SchedulerListener listener,
                                 DriverSettings settings,
                                 JobClaimProperties props) {
        return new WorkerPool(i -> new SchedulerDriver("jobclaim-worker-" + i,
                preemption, leases, executors, cron, clock, listener, settings),
                props.getWorker().getCount());
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobclaim.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WorkerPoolLifecycle workerPoolLifecycle(WorkerPool pool, ExecutorRegistry executors, JobClaimProperties props) {
        log.info("jobclaim workers: count={} executors={}", props.getWorker().getCount(), executors.ids());
        return new WorkerPoolLifecycle(pool, props.getWorker().getShutdownTimeout());
    }

    // --- 스케줄러 등록 (주기는 jobclaim.scheduler.maintenance-delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "jobclaim.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public JobClaimSchedulers jobClaimSchedulers(MaintenanceService maintenance) {
        return new JobClaimSchedulers(maintenance);
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobAdminService admin) {
        return new CatalogRegistrar(admin);
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobclaim.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, JobClaimProperties props) {
        log.info("catalog: \n{}", props.getCatalog().getJobs().stream()
                .map(JobClaimProperties.JobDef::toString).collect(Collectors.joining("\n")));
        return args -> registrar.register(props.getCatalog());
    }
}
