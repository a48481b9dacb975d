package com.socialfeed.infrastructure.exception;

/**
 * Connection reset, refused or timed out, or a busy server. Worth retrying with backoff.
 */
public class TransientInfrastructureException extends InfrastructureException {

    public TransientInfrastructureException(String operation, Throwable cause) {
        super(operation, "Transient failure in " + operation + ": " + cause.getMessage(), cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
