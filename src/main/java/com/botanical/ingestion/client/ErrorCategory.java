package com.botanical.ingestion.client;

/**
 * Failure categories used for retry decisions and error counters.
 */
public enum ErrorCategory {
    TIMEOUT,
    NETWORK,
    RATE_LIMIT,
    SERVER_ERROR,
    CLIENT_ERROR,
    CIRCUIT_BREAKER,
    CONFIGURATION,
    UNKNOWN
}
