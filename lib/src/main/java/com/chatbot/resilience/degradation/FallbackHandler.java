package com.chatbot.resilience.degradation;

/**
 * Per-service fallback registered with the coordinator. Runs when a call to the
 * service fails or is skipped and the caller supplied no fallback of its own, or
 * that fallback failed.
 */
@FunctionalInterface
public interface FallbackHandler {
    
    /**
     * Produces a substitute result.
     * 
     * @param error the failure, or null when the call was skipped because the service is unavailable
     * @param options the options of the failed call
     * @return the substitute result, which must be assignable to the call's result type
     * @throws Exception if no substitute can be produced; the coordinator moves on to the next fallback
     */
    Object handle(Throwable error, ExecuteOptions<?> options) throws Exception;
}
