package com.chatbot.resilience.datastore;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Exception thrown when data store operations fail.
 */
public class DataStoreException extends RuntimeException {
    
    public DataStoreException(String message) {
        super(message);
    }
    
    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Exception thrown when the store is used before {@link ResilientDataStore#initialize()}
     * or after it was closed.
     */
    public static class NotInitializedException extends DataStoreException {
        public NotInitializedException() {
            super("Database not initialized");
        }
    }
    
    /**
     * Exception thrown when a table is not in the allow-list or an identifier is malformed.
     */
    public static class InvalidIdentifierException extends DataStoreException {
        private final String identifier;
        
        public InvalidIdentifierException(String identifier, String reason) {
            super(String.format("Invalid identifier: %s. %s", identifier, reason));
            this.identifier = identifier;
        }
        
        public String getIdentifier() {
            return identifier;
        }
    }
    
    /**
     * Exception thrown when a statement fails after any retries.
     */
    public static class QueryFailedException extends DataStoreException {
        public QueryFailedException(String message, Throwable cause) {
            super(message, cause);
        }
        
        /**
         * SQLState of the underlying driver error, if there is one.
         */
        public Optional<String> getSqlState() {
            Throwable current = getCause();
            while (current != null) {
                if (current instanceof SQLException && ((SQLException) current).getSQLState() != null) {
                    return Optional.of(((SQLException) current).getSQLState());
                }
                current = current.getCause();
            }
            return Optional.empty();
        }
    }
    
    /**
     * Exception thrown when a transaction could not be started or committed, or when its
     * callback failed with a checked exception. The transaction has been rolled back.
     */
    public static class TransactionFailedException extends DataStoreException {
        public TransactionFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
