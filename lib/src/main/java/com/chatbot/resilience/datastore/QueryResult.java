package com.chatbot.resilience.datastore;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rows returned by a statement, each a column-ordered map, plus the affected row count.
 * For statements without a result set {@code rows} is empty and {@code rowCount} is the
 * update count.
 */
public record QueryResult(List<Map<String, Object>> rows, int rowCount) {
    
    public QueryResult {
        rows = List.copyOf(rows);
    }
    
    public Optional<Map<String, Object>> first() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
    
    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
