package io.classguard.store;

import java.sql.SQLException;

/**
 * Thrown when the reading store cannot complete an operation, typically
 * because the database is unreachable. Callers on the ingestion path retry;
 * callers on the query path answer with an empty result.
 * <p>
 * Failures caused by the data itself (SQLState class 22, data exception, or
 * 23, integrity constraint violation) are not transient: the same statement
 * will fail again however often it is retried.
 */
public class PersistenceException extends RuntimeException {

    private final boolean transientFailure;

    public PersistenceException(String message) {
        super(message);
        this.transientFailure = true;
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
        this.transientFailure = !isDataError(cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public String getSqlState() {
        return getCause() instanceof SQLException ? ((SQLException) getCause()).getSQLState() : null;
    }

    private static boolean isDataError(Throwable cause) {
        if (!(cause instanceof SQLException)) {
            return false;
        }
        String state = ((SQLException) cause).getSQLState();
        return state != null && (state.startsWith("22") || state.startsWith("23"));
    }
}
