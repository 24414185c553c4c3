package com.seatwatch.monitor.util;

import java.sql.SQLException;

/**
 * Classifies integrity violations by the SQLSTATE of the underlying JDBC error.
 * H2 reports a missing parent row as 23506 where PostgreSQL uses 23503 for both directions.
 */
public final class ConstraintViolations {

    static final String UNIQUE_VIOLATION = "23505";
    static final String FOREIGN_KEY_VIOLATION = "23503";
    static final String FOREIGN_KEY_PARENT_MISSING = "23506";

    private ConstraintViolations() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isUniqueViolation(Throwable error) {
        return UNIQUE_VIOLATION.equals(sqlState(error));
    }

    public static boolean isForeignKeyViolation(Throwable error) {
        String state = sqlState(error);
        return FOREIGN_KEY_VIOLATION.equals(state) || FOREIGN_KEY_PARENT_MISSING.equals(state);
    }

    static String sqlState(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException && ((SQLException) current).getSQLState() != null) {
                return ((SQLException) current).getSQLState();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
