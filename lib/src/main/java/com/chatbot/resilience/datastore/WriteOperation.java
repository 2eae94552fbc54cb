package com.chatbot.resilience.datastore;

import java.util.Locale;

/**
 * Kinds of write the data store can defer while the database is unavailable.
 */
public enum WriteOperation {
    INSERT,
    UPDATE,
    DELETE;
    
    /**
     * Lower-case name used in queue entries and acknowledgements.
     */
    public String operationName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
