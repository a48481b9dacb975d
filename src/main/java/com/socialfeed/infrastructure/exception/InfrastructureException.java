package com.socialfeed.infrastructure.exception;

/**
 * Failure of an external collaborator (cache, pub/sub, storage). Never used for domain outcomes.
 */
public abstract class InfrastructureException extends RuntimeException {

    private final String operation;

    protected InfrastructureException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    public abstract boolean isRetryable();
}
