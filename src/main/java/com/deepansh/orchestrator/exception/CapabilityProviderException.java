package com.deepansh.orchestrator.exception;

/**
 * The capability provider could not be started, or a call to it failed at the transport level.
 */
public class CapabilityProviderException extends OrchestrationException {

    public CapabilityProviderException(String message) {
        super(message);
    }

    public CapabilityProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
