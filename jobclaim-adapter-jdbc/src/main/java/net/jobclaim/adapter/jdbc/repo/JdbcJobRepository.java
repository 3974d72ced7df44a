package net.jobclaim.adapter.jdbc.repo;

import net.jobclaim.adapter.jdbc.JdbcUtil;
import net.jobclaim.adapter.jdbc.TxContext;
import net.jobclaim.adapter.jdbc.mapper.RowMappers;
import net.jobclaim.core.error.DuplicateJobException;
import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobStatus;
import net.jobclaim.core.model.JobUpdate;
import net.jobclaim.core.model.NewJob;
import net.jobclaim.core.spi.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * TB_JOB 접근. 락(FOR UPDATE)을 쓰지 않고 VERSION 비교만으로 소유권을 가린다.
 * 시각은 전부 호출자가 넘긴 값을 쓴다(DB CURRENT_TIMESTAMP 사용 안 함).
 */
public final class JdbcJobRepository implements JobRepository {

    @Override
    public Optional<Job> findDueCandidate(Instant now) {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT  *
                FROM    TB_JOB
                WHERE   STATUS = 'WAITING'
                  AND   NEXT_DUE_AT < ?
                ORDER BY NEXT_DUE_AT ASC, ID ASC
            """)) {
            ps.setMaxRows(1);
            JdbcUtil.setInstant(ps, 1, now);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw JdbcUtil.translate("findDueCandidate", e);
        }
    }

    @Override
    public int conditionalUpdate(long id, long expectedVersion, JobUpdate update) {
        StringBuilder sql = new StringBuilder("UPDATE TB_JOB SET VERSION = ?, UPDATED_AT = ?");
        if (update.status() != null) sql.append(", STATUS = ?");
        if (update.nextDueAt() != null) sql.append(", NEXT_DUE_AT = ?");
        sql.append(" WHERE ID = ? AND VERSION = ?");

        try (PreparedStatement ps = mustConn().prepareStatement(sql.toString())) {
            int i = 1;
            ps.setLong(i++, expectedVersion + 1);
            JdbcUtil.setInstant(ps, i++, update.updatedAt());
            if (update.status() != null) ps.setString(i++, update.status().code());
            if (update.nextDueAt() != null) JdbcUtil.setInstant(ps, i++, update.nextDueAt());
            ps.setLong(i++, id);
            ps.setLong(i, expectedVersion);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw JdbcUtil.translate("conditionalUpdate(id=" + id + ")", e);
        }
    }

    @Override
    public List<Job> findStale(Instant threshold) {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT  *
                FROM    TB_JOB
                WHERE   STATUS = 'RUNNING'
                  AND   UPDATED_AT < ?
                ORDER BY UPDATED_AT ASC, ID ASC
            """)) {
            JdbcUtil.setInstant(ps, 1, threshold);
            return list(ps);
        } catch (SQLException e) {
            throw JdbcUtil.translate("findStale", e);
        }
    }

    @Override
    public Optional<Job> findById(long id) {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw JdbcUtil.translate("findById", e);
        }
    }

    @Override
    public Optional<Job> findByName(String name) {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE NAME = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw JdbcUtil.translate("findByName", e);
        }
    }

    @Override
    public List<Job> findAll() {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_JOB ORDER BY ID")) {
            return list(ps);
        } catch (SQLException e) {
            throw JdbcUtil.translate("findAll", e);
        }
    }

    @Override
    public Job insert(NewJob job, Instant now) {
        Connection c = mustConn();
        long id;
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_JOB(NAME, EXECUTOR, EXPRESSION, CONFIG, STATUS, VERSION, NEXT_DUE_AT, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, 'WAITING', 0, ?, ?, ?)
            """, new String[]{"ID"})) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, job.executor());
            ps.setString(i++, job.expression());
            ps.setString(i++, job.config());
            JdbcUtil.setInstant(ps, i++, job.nextDueAt());
            JdbcUtil.setInstant(ps, i++, now);
            JdbcUtil.setInstant(ps, i, now);
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new IllegalStateException("no generated key for job: " + job.name());
                id = k.getLong(1);
            }
        } catch (SQLException e) {
            if (JdbcUtil.isUniqueViolation(e)) throw new DuplicateJobException(job.name(), e);
            throw JdbcUtil.translate("insert(" + job.name() + ")", e);
        }
        return findById(id).orElseThrow(() -> new IllegalStateException("insert failed to load job: " + job.name()));
    }

    @Override
    public int transition(long id, JobStatus from, JobStatus to, Instant now) {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_JOB
                   SET STATUS     = ?,
                       VERSION    = VERSION + 1,
                       UPDATED_AT = ?
                 WHERE ID = ?
                   AND STATUS = ?
            """)) {
            ps.setString(1, to.code());
            JdbcUtil.setInstant(ps, 2, now);
            ps.setLong(3, id);
            ps.setString(4, from.code());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw JdbcUtil.translate("transition(id=" + id + ")", e);
        }
    }

    @Override
    public int delete(long id) {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw JdbcUtil.translate("delete(id=" + id + ")", e);
        }
    }

    private static List<Job> list(PreparedStatement ps) throws SQLException {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJob(rs));
        }
        return out;
    }

    private Connection mustConn() {
        return TxContext.required();
    }
}
