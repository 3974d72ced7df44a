package net.jobclaim.bootstrap.catalog;

import net.jobclaim.bootstrap.props.JobClaimProperties;
import net.jobclaim.core.admin.JobAdminService;
import net.jobclaim.core.error.DuplicateJobException;
import net.jobclaim.integration.spring.cron.CronSlotPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 설정에 선언된 Job 을 기동 시 등록한다.
 * 이름이 이미 있으면 건드리지 않는다(운영 중 바뀐 NEXT_DUE_AT/상태 보존).
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobAdminService admin;

    public CatalogRegistrar(JobAdminService admin) {
        this.admin = admin;
    }

    /** @return 새로 만든 Job 수 */
    public int register(JobClaimProperties.Catalog catalog) throws Exception {
        int created = 0;
        for (var def : catalog.getJobs()) {
            if (registerOne(def)) created++;
        }
        log.info("Catalog registered: declared={} created={}", catalog.getJobs().size(), created);
        return created;
    }

    private boolean registerOne(JobClaimProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getExecutor() == null || def.getExpression() == null) {
            throw new IllegalArgumentException("job.name, job.executor and job.expression are required: " + def);
        }
        CronSlotPlanner.validate(def.getExpression());

        if (admin.findByName(def.getName()).isPresent()) {
            log.debug("catalog job '{}' already exists, skipped", def.getName());
            return false;
        }
        try {
            var job = admin.create(def.getName(), def.getExecutor(), def.getExpression(), def.getConfig(), null);
            log.info("catalog job '{}' created: id={} nextDueAt={}", job.name(), job.id(), job.nextDueAt());
            return true;
        } catch (DuplicateJobException e) {
            // 다른 노드가 같은 카탈로그로 먼저 등록
            log.debug("catalog job '{}' registered concurrently, skipped", e.getJobName());
            return false;
        }
    }
}
