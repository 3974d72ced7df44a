package net.jobclaim.adapter.jdbc;

import net.jobclaim.core.error.PersistenceException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** 시각은 UTC 오프셋을 붙여 바인딩한다. JVM 기본 타임존을 거치지 않는다 */
    public static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, value.atOffset(ZoneOffset.UTC));
        }
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime v = rs.getObject(column, OffsetDateTime.class);
        return v == null ? null : v.toInstant();
    }

    /** 유니크 제약 위반만. NOT NULL/CHECK 위반은 여기 걸리지 않는다 */
    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException x = e; x != null; x = x.getNextException()) {
            String state = x.getSQLState();
            if ("23505".equals(state)) return true;             // H2, PostgreSQL
            if (x.getErrorCode() == 1 && state != null && state.startsWith("23")) return true; // Oracle ORA-00001
        }
        return false;
    }

    public static PersistenceException translate(String what, SQLException e) {
        return new PersistenceException(what + " failed: " + e.getMessage(), e);
    }
}
