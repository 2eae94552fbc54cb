package com.chatbot.resilience.datastore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statement access bound to one transaction's connection. Statements run here are not
 * retried and are never routed to the replica.
 */
public class TransactionScope {
    
    private final Connection connection;
    private final int queryTimeoutSeconds;
    
    TransactionScope(Connection connection, int queryTimeoutSeconds) {
        this.connection = connection;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }
    
    public QueryResult query(String sql, List<?> params) throws SQLException {
        return JdbcStatements.execute(connection, sql, params, queryTimeoutSeconds);
    }
    
    public QueryResult query(String sql, Object... params) throws SQLException {
        return query(sql, Arrays.asList(params));
    }
    
    public Optional<Map<String, Object>> getOne(String sql, Object... params) throws SQLException {
        return query(sql, Arrays.asList(params)).first();
    }
    
    /**
     * The underlying connection, for driver-specific work. Do not commit, roll back or close it.
     */
    public Connection getConnection() {
        return connection;
    }
}
