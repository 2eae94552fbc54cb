package com.chatbot.resilience.model;

/**
 * Health check result of the degradation coordinator.
 *
 * @param healthy false while the level is CRITICAL or OFFLINE
 * @param details the full status
 */
public record DegradationHealth(boolean healthy, SystemStatus details) {
}
