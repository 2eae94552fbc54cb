package com.chatbot.resilience.datastore;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies database errors by SQLState and message. The whole cause chain is inspected,
 * so wrapped driver errors classify like the originals.
 */
public final class TransientErrorClassifier {
    
    /**
     * PostgreSQL SQLStates worth retrying.
     */
    public static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "40001", // serialization_failure
        "40P01", // deadlock_detected
        "57P01", // admin_shutdown
        "57P02", // crash_shutdown
        "57P03", // cannot_connect_now
        "08000", // connection_exception
        "08001", // sqlclient_unable_to_establish_sqlconnection
        "08003", // connection_does_not_exist
        "08004", // sqlserver_rejected_establishment_of_sqlconnection
        "08006", // connection_failure
        "53000", // insufficient_resources
        "53100", // disk_full
        "53200", // out_of_memory
        "53300"  // too_many_connections
    );
    
    private static final List<String> TRANSIENT_MESSAGES = List.of(
        "econnrefused",
        "enotfound",
        "etimedout",
        "econnreset",
        "connection terminated",
        "connection refused",
        "timeout expired"
    );
    
    private static final List<String> CONNECTION_ERROR_MESSAGES = List.of(
        "econnrefused",
        "enotfound",
        "etimedout",
        "connection_timeout",
        "connection refused"
    );
    
    private TransientErrorClassifier() {
    }
    
    public static boolean isTransient(Throwable error) {
        for (Throwable current = error; current != null; current = nextCause(current)) {
            if (current instanceof SQLTransientConnectionException) {
                return true;
            }
            if (current instanceof SQLException) {
                String sqlState = ((SQLException) current).getSQLState();
                if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                    return true;
                }
            }
            if (messageMatches(current, TRANSIENT_MESSAGES)) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * Whether the error means the database could not be reached, as opposed to a
     * statement failing on a live connection.
     */
    public static boolean isConnectionError(Throwable error) {
        for (Throwable current = error; current != null; current = nextCause(current)) {
            if (current instanceof SQLTransientConnectionException) {
                return true;
            }
            if (current instanceof SQLException) {
                String sqlState = ((SQLException) current).getSQLState();
                if (sqlState != null && sqlState.startsWith("08")) {
                    return true;
                }
            }
            if (messageMatches(current, CONNECTION_ERROR_MESSAGES)) {
                return true;
            }
        }
        return false;
    }
    
    private static boolean messageMatches(Throwable error, List<String> patterns) {
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
    
    private static Throwable nextCause(Throwable error) {
        Throwable cause = error.getCause();
        return cause == error ? null : cause;
    }
}
