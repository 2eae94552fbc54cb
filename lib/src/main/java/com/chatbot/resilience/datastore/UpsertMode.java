package com.chatbot.resilience.datastore;

/**
 * Conflict handling for {@link ResilientDataStore#upsert}.
 */
public enum UpsertMode {
    /** Keep the existing row and return it. */
    DO_NOTHING,
    /** Overwrite every non-conflict column with the inserted values. */
    OVERWRITE
}
