package com.chatbot.resilience.datastore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A deferred write, queued as the payload of a {@link com.chatbot.resilience.model.QueuedWrite}.
 *
 * @param data column values for INSERT and UPDATE, empty for DELETE
 * @param where match conditions for UPDATE and DELETE, empty for INSERT
 */
public record WriteRequest(WriteOperation operation, String table, Map<String, Object> data,
                           Map<String, Object> where) {
    
    public WriteRequest {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(table, "table");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        where = where == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(where));
    }
    
    public static WriteRequest insert(String table, Map<String, Object> data) {
        return new WriteRequest(WriteOperation.INSERT, table, data, Map.of());
    }
    
    public static WriteRequest update(String table, Map<String, Object> data, Map<String, Object> where) {
        return new WriteRequest(WriteOperation.UPDATE, table, data, where);
    }
    
    public static WriteRequest delete(String table, Map<String, Object> where) {
        return new WriteRequest(WriteOperation.DELETE, table, Map.of(), where);
    }
}
