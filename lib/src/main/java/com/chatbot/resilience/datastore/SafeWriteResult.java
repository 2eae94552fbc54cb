package com.chatbot.resilience.datastore;

import java.util.Optional;

/**
 * Outcome of a safe write: either executed with its result, or queued for replay once
 * the database recovers.
 */
public class SafeWriteResult<T> {
    
    private final boolean queued;
    private final WriteOperation operation;
    private final String table;
    private final T result;
    
    private SafeWriteResult(boolean queued, WriteOperation operation, String table, T result) {
        this.queued = queued;
        this.operation = operation;
        this.table = table;
        this.result = result;
    }
    
    public static <T> SafeWriteResult<T> executed(WriteOperation operation, String table, T result) {
        return new SafeWriteResult<>(false, operation, table, result);
    }
    
    public static <T> SafeWriteResult<T> queued(WriteOperation operation, String table) {
        return new SafeWriteResult<>(true, operation, table, null);
    }
    
    public boolean isQueued() {
        return queued;
    }
    
    public WriteOperation getOperation() {
        return operation;
    }
    
    public String getTable() {
        return table;
    }
    
    /**
     * The write's result; empty when queued, or when an update matched no row.
     */
    public Optional<T> getResult() {
        return Optional.ofNullable(result);
    }
    
    @Override
    public String toString() {
        return String.format("SafeWriteResult{queued=%s, operation=%s, table='%s'}",
            queued, operation.operationName(), table);
    }
}
