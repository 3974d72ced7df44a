package net.jobclaim.adapter.jdbc.mapper;

import net.jobclaim.adapter.jdbc.JdbcUtil;
import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobStatus;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("EXECUTOR"),
                rs.getString("EXPRESSION"),
                rs.getString("CONFIG"),
                JobStatus.from(rs.getString("STATUS")),
                rs.getLong("VERSION"),
                JdbcUtil.getInstant(rs, "NEXT_DUE_AT"),
                JdbcUtil.getInstant(rs, "CREATED_AT"),
                JdbcUtil.getInstant(rs, "UPDATED_AT")
        );
    }
}
