package com.socialfeed.infrastructure.resilience;

import com.socialfeed.infrastructure.exception.FatalInfrastructureException;
import com.socialfeed.infrastructure.exception.InfrastructureException;
import com.socialfeed.infrastructure.exception.TransientInfrastructureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Splits infrastructure failures into retryable and fatal ones.
 * Credential errors are fatal even when the driver reports them as connection failures.
 */
@Component
public class ErrorClassifier {

    private static final List<String> FATAL_MARKERS = List.of(
        "noauth", "wrongpass", "authentication", "invalid password", "wrongtype", "unknown command"
    );

    private static final List<String> RETRYABLE_MARKERS = List.of(
        "econnreset", "econnrefused", "etimedout", "timeout", "timed out",
        "connection", "socket hang up", "busy", "loading", "tryagain"
    );

    public InfrastructureException classify(String operation, Throwable error) {
        if (error instanceof InfrastructureException infrastructure) {
            return infrastructure;
        }
        return isRetryable(error)
            ? new TransientInfrastructureException(operation, error)
            : new FatalInfrastructureException(operation, error);
    }

    public boolean isRetryable(Throwable error) {
        if (error instanceof InfrastructureException infrastructure) {
            return infrastructure.isRetryable();
        }
        if (anyMessageContains(error, FATAL_MARKERS)) {
            return false;
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (isTransientType(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return anyMessageContains(error, RETRYABLE_MARKERS);
    }

    private boolean isTransientType(Throwable error) {
        return error instanceof RedisConnectionFailureException
            || error instanceof QueryTimeoutException
            || error instanceof TransientDataAccessException
            || error instanceof TimeoutException
            || error instanceof IOException;
    }

    private boolean anyMessageContains(Throwable error, List<String> markers) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : markers) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
