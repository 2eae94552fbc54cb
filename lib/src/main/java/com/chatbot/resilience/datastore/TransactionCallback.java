package com.chatbot.resilience.datastore;

/**
 * Work executed inside {@link ResilientDataStore#transaction}. Throwing any exception
 * rolls the transaction back.
 */
@FunctionalInterface
public interface TransactionCallback<T> {
    
    T execute(TransactionScope scope) throws Exception;
}
