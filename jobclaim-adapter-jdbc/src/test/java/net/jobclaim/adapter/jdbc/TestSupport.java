package net.jobclaim.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.jobclaim.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.UUID;

/**
 * 인수 테스트 공통: Hikari + Flyway.
 * JOBCLAIM_JDBC_URL 이 없으면 인메모리 H2 를 쓴다(도커 불필요).
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected DataSource ds;
    protected TxRunner tx;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("JOBCLAIM_JDBC_URL");
        String user = System.getenv("JOBCLAIM_USERNAME");
        String pass = System.getenv("JOBCLAIM_PASSWORD");

        if (url == null || url.isBlank()) {
            url = "jdbc:h2:mem:jobclaim-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
            user = "sa";
            pass = "";
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(12);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations(url.startsWith("jdbc:oracle:") ? "classpath:db/migration/oracle" : "classpath:db/migration/h2")
                .baselineOnMigrate(true)
                .load()
                .migrate();

        tx = new JdbcTxRunner(ds);
    }

    @BeforeEach
    void truncateJobs() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                st.execute("DELETE FROM TB_JOB");
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }

    // ===== helpers =====

    /** 필드를 직접 지정해 TB_JOB 한 행을 넣는다 */
    protected long seedJob(String name, String status, long version, Instant nextDueAt, Instant updatedAt) throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.get().prepareStatement("""
                INSERT INTO TB_JOB(NAME, EXECUTOR, EXPRESSION, CONFIG, STATUS, VERSION, NEXT_DUE_AT, CREATED_AT, UPDATED_AT)
                VALUES (?, 'noop', '0 0 * * * ?', NULL, ?, ?, ?, ?, ?)
            """, new String[]{"ID"})) {
                ps.setString(1, name);
                ps.setString(2, status);
                ps.setLong(3, version);
                JdbcUtil.setInstant(ps, 4, nextDueAt);
                JdbcUtil.setInstant(ps, 5, updatedAt);
                JdbcUtil.setInstant(ps, 6, updatedAt);
                ps.executeUpdate();
                try (ResultSet k = ps.getGeneratedKeys()) { k.next(); return k.getLong(1); }
            }
        });
    }

    protected long seedWaiting(String name, long version, Instant nextDueAt) throws Exception {
        return seedJob(name, "WAITING", version, nextDueAt, nextDueAt.minusSeconds(3600));
    }
}
