package com.deepansh.orchestrator.exception;

/**
 * Non-retryable failure: bad configuration, rejected credentials, malformed model reply.
 * Listed in the circuit breaker's ignore list so it never trips the breaker.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
