package testrelay.coordinator.store;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Small JDBC helpers shared by the repositories.
 */
final class JdbcSupport {

    // H2 lock timeout / PostgreSQL lock_not_available / serialization failure
    private static final String H2_LOCK_TIMEOUT_STATE = "HYT00";
    private static final String PG_LOCK_NOT_AVAILABLE = "55P03";
    private static final String SERIALIZATION_FAILURE = "40001";
    private static final int H2_LOCK_TIMEOUT_CODE = 50200;
    private static final int H2_CONCURRENT_UPDATE_CODE = 90131;

    private JdbcSupport() {
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Cut text to fit a VARCHAR column of the given width.
     */
    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    /**
     * True when the database refused a row lock because another transaction
     * holds it.
     */
    static boolean isLockConflict(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            String state = cur.getSQLState();
            if (H2_LOCK_TIMEOUT_STATE.equals(state)
                    || PG_LOCK_NOT_AVAILABLE.equals(state)
                    || SERIALIZATION_FAILURE.equals(state)
                    || cur.getErrorCode() == H2_LOCK_TIMEOUT_CODE
                    || cur.getErrorCode() == H2_CONCURRENT_UPDATE_CODE) {
                return true;
            }
        }
        return false;
    }
}
