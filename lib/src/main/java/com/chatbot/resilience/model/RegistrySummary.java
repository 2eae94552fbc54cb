package com.chatbot.resilience.model;

/**
 * Breaker counts by state.
 */
public record RegistrySummary(int total, int closed, int open, int halfOpen) {
}
