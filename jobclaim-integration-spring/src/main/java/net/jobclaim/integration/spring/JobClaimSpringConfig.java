package net.jobclaim.integration.spring;

import net.jobclaim.adapter.jdbc.repo.JdbcJobRepository;
import net.jobclaim.core.spi.Clock;
import net.jobclaim.core.spi.JobRepository;
import net.jobclaim.core.spi.TxRunner;
import net.jobclaim.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class JobClaimSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용). 커넥션은 TxContext 에서 꺼낸다
    @Bean public JobRepository jobRepository() { return new JdbcJobRepository(); }

    // 모든 시각은 이 Clock 에서 나온다. DB 시계는 쓰지 않는다
    @Bean public Clock systemClock() { return Clock.system(); }
}
