package com.botanical.ingestion.client;

/**
 * Circuit breaker states.
 */
public enum CircuitState {
    /** Calls pass through; failures are counted. */
    CLOSED,
    /** Calls are rejected until the cooldown elapses. */
    OPEN,
    /** Trial calls pass through; one failure reopens the circuit. */
    HALF_OPEN
}
