package com.socialfeed.infrastructure.resilience;

import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.infrastructure.config.AppProperties;
import com.socialfeed.infrastructure.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff around cache and pub/sub calls.
 * <p>
 * Only transient failures are retried. Once the attempt budget is spent the configured fallback is
 * returned; without one the classified {@link InfrastructureException} propagates and the caller
 * must take its durable-storage path.
 */
@Component
public class ResiliencePolicy {

    private static final Logger log = LoggerFactory.getLogger(ResiliencePolicy.class);

    private final AppProperties.Cache defaults;
    private final ErrorClassifier classifier;
    private final MetricsPort metrics;
    private final BackoffSleeper sleeper;

    @Autowired
    public ResiliencePolicy(AppProperties appProperties, ErrorClassifier classifier, MetricsPort metrics) {
        this(appProperties, classifier, metrics, BackoffSleeper.THREAD_SLEEP);
    }

    public ResiliencePolicy(AppProperties appProperties, ErrorClassifier classifier, MetricsPort metrics, BackoffSleeper sleeper) {
        this.defaults = appProperties.getCache();
        this.classifier = classifier;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public <T> AttemptOptions<T> defaultOptions(String operation) {
        return new AttemptOptions<>(
            operation,
            defaults.getMaxAttempts(),
            defaults.getBaseDelayMs(),
            defaults.getMaxDelayMs(),
            defaults.isJitter(),
            false,
            null
        );
    }

    public <T> T attempt(String operation, Supplier<T> action) {
        return attempt(action, defaultOptions(operation));
    }

    public <T> T attempt(String operation, Supplier<T> action, T fallbackValue) {
        return attempt(action, this.<T>defaultOptions(operation).withFallback(fallbackValue));
    }

    /**
     * Runs a pure cache-warm write: failures are logged once the budget is spent, never thrown.
     */
    public void runQuietly(String operation, Runnable action) {
        attempt(() -> {
            action.run();
            return Boolean.TRUE;
        }, this.<Boolean>defaultOptions(operation).withFallback(Boolean.FALSE));
    }

    public <T> T attempt(Supplier<T> action, AttemptOptions<T> options) {
        InfrastructureException lastFailure = null;

        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                lastFailure = classifier.classify(options.operation(), e);
                if (!lastFailure.isRetryable()) {
                    log.warn("Non-retryable failure in {}: {}", options.operation(), e.getMessage());
                    break;
                }
                if (attempt == options.maxAttempts()) {
                    log.warn("Attempts exhausted for {} after {} tries: {}", options.operation(), attempt, e.getMessage());
                    break;
                }
                long delay = withJitter(options.backoffFor(attempt), options.jitter());
                log.debug("Retrying {} in {}ms (attempt {}/{}): {}",
                    options.operation(), delay, attempt, options.maxAttempts(), e.getMessage());
                if (!pause(delay)) {
                    log.warn("Interrupted while backing off {}", options.operation());
                    break;
                }
            }
        }

        if (options.hasFallback()) {
            metrics.incrementCacheFallbacks(options.operation());
            log.warn("Serving fallback for {}", options.operation());
            return options.fallbackValue();
        }
        throw lastFailure;
    }

    private long withJitter(long delay, boolean jitter) {
        if (!jitter || delay <= 0) {
            return delay;
        }
        return delay + ThreadLocalRandom.current().nextLong(delay / 2 + 1);
    }

    private boolean pause(long delay) {
        if (delay <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
