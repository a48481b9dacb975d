package com.socialfeed.infrastructure.exception;

/**
 * Non-retryable failure such as rejected credentials or a malformed command.
 */
public class FatalInfrastructureException extends InfrastructureException {

    public FatalInfrastructureException(String operation, Throwable cause) {
        super(operation, "Fatal failure in " + operation + ": " + cause.getMessage(), cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
