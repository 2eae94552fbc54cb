package com.chatbot.resilience.degradation;

import com.chatbot.resilience.model.QueuedWrite;

/**
 * Executes deferred writes when their service recovers.
 */
@FunctionalInterface
public interface QueuedWriteProcessor {
    
    /**
     * Replays one queued write. Returning normally removes it from the queue;
     * throwing counts a failed replay attempt.
     * 
     * @param write the queued write
     * @throws Exception if the write could not be applied
     */
    void process(QueuedWrite write) throws Exception;
}
