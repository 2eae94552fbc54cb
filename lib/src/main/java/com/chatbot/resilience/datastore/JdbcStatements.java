package com.chatbot.resilience.datastore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a parameterized statement on a connection and maps its rows.
 */
final class JdbcStatements {
    
    private JdbcStatements() {
    }
    
    static QueryResult execute(Connection connection, String sql, List<?> params, int queryTimeoutSeconds)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            if (queryTimeoutSeconds > 0) {
                statement.setQueryTimeout(queryTimeoutSeconds);
            }
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            
            if (statement.execute()) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    List<Map<String, Object>> rows = mapRows(resultSet);
                    return new QueryResult(rows, rows.size());
                }
            }
            return new QueryResult(List.of(), Math.max(statement.getUpdateCount(), 0));
        }
    }
    
    static List<Map<String, Object>> mapRows(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columns = metaData.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int column = 1; column <= columns; column++) {
                row.put(metaData.getColumnLabel(column), resultSet.getObject(column));
            }
            rows.add(row);
        }
        return rows;
    }
}
