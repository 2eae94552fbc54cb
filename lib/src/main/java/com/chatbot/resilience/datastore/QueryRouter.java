package com.chatbot.resilience.datastore;

import java.util.Locale;

/**
 * Decides whether a statement may run on the read replica.
 */
public final class QueryRouter {
    
    public enum Target {
        PRIMARY,
        REPLICA
    }
    
    private QueryRouter() {
    }
    
    /**
     * A statement is read-only when it starts with SELECT and takes no row locks.
     * WITH statements always go to the primary.
     */
    public static boolean isReadOnlyQuery(String sql) {
        if (sql == null) {
            return false;
        }
        String normalized = sql.trim().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith("SELECT")) {
            return false;
        }
        return !normalized.contains("FOR UPDATE") && !normalized.contains("FOR SHARE");
    }
    
    /**
     * @param replicaAvailable whether a replica pool exists and passed its probe
     */
    public static Target route(String sql, QueryOptions options, boolean replicaAvailable) {
        if (options.isUsePrimary() || !replicaAvailable) {
            return Target.PRIMARY;
        }
        return isReadOnlyQuery(sql) ? Target.REPLICA : Target.PRIMARY;
    }
}
