package com.genflow.engine.retry;

import com.genflow.core.model.RetryConfig;
import com.genflow.core.model.RetryEvent;
import com.genflow.core.model.RetryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs a fallible operation with backoff between attempts.
 *
 * <p>Retryable failures (timeout, rate limit, network) are absorbed until
 * {@code maxRetries} retries have been spent; the outcome then reports the last
 * error. A fatal failure ends the run after the attempt that raised it.
 * Expected failures are returned in the {@link RetryOutcome}, never thrown.
 */
public class RetryPolicy {
    
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);
    
    private final RetryConfig defaults;
    private final Sleeper sleeper;
    private final ErrorClassifier classifier;
    private final List<RetryListener> listeners = new CopyOnWriteArrayList<>();
    
    public RetryPolicy(RetryConfig defaults) {
        this(defaults, Sleeper.threadSleep(), new ErrorClassifier());
    }
    
    public RetryPolicy(RetryConfig defaults, Sleeper sleeper, ErrorClassifier classifier) {
        this.defaults = defaults;
        this.sleeper = sleeper;
        this.classifier = classifier;
    }
    
    public RetryConfig getDefaults() {
        return defaults;
    }
    
    public ErrorClassifier getClassifier() {
        return classifier;
    }
    
    public void addListener(RetryListener listener) {
        listeners.add(listener);
    }
    
    public void removeListener(RetryListener listener) {
        listeners.remove(listener);
    }
    
    public <T> RetryOutcome<T> run(RetryableOperation<T> operation) {
        return run(operation, defaults, null);
    }
    
    public <T> RetryOutcome<T> run(RetryableOperation<T> operation, RetryConfig config) {
        return run(operation, config, null);
    }
    
    /**
     * Run the operation under the given config.
     *
     * @param listener extra listener for this run only, may be null
     */
    public <T> RetryOutcome<T> run(RetryableOperation<T> operation, RetryConfig config, RetryListener listener) {
        int maxAttempts = config.maxAttempts();
        long startNanos = System.nanoTime();
        Throwable lastError = null;
        
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            emit(RetryEvent.attempt(attempt, maxAttempts), listener);
            try {
                T result = operation.execute(attempt);
                emit(RetryEvent.success(attempt, maxAttempts), listener);
                return RetryOutcome.succeeded(result, attempt, elapsedSince(startNanos));
            } catch (Exception e) {
                lastError = e;
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                if (!classifier.isRetryable(e)) {
                    log.warn("Attempt {}/{} failed with non-retryable error: {}",
                        attempt, maxAttempts, e.getMessage());
                    emit(RetryEvent.failure(attempt, maxAttempts, e), listener);
                    return RetryOutcome.failed(e, attempt, elapsedSince(startNanos));
                }
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = calculateDelay(attempt, config);
                log.warn("Attempt {}/{} failed ({}), retrying in {} ms",
                    attempt, maxAttempts, e.getMessage(), delay.toMillis());
                emit(RetryEvent.retry(attempt, maxAttempts, delay, e), listener);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting to retry after attempt {}", attempt);
                    emit(RetryEvent.failure(attempt, maxAttempts, e), listener);
                    return RetryOutcome.failed(e, attempt, elapsedSince(startNanos));
                }
            }
        }
        
        log.warn("All {} attempts failed: {}", maxAttempts,
            lastError == null ? "unknown error" : lastError.getMessage());
        emit(RetryEvent.exhausted(maxAttempts, maxAttempts, lastError), listener);
        return RetryOutcome.failed(lastError, maxAttempts, elapsedSince(startNanos));
    }
    
    /**
     * Delay before the retry that follows the given failed attempt.
     *
     * <p>An explicit delay sequence is indexed by attempt and clamped to its last
     * entry. Otherwise FIXED = base, LINEAR = base * attempt,
     * EXPONENTIAL = base * 2^(attempt - 1). Every result is capped at maxDelay.
     *
     * @param attemptNumber 1-based number of the attempt that just failed
     */
    public static Duration calculateDelay(int attemptNumber, RetryConfig config) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        long delayMs;
        if (config.hasDelaySequence()) {
            List<Duration> sequence = config.delaySequence();
            delayMs = sequence.get(Math.min(attemptNumber, sequence.size()) - 1).toMillis();
        } else {
            long baseMs = config.baseDelay().toMillis();
            delayMs = switch (config.strategy()) {
                case FIXED -> baseMs;
                case LINEAR -> saturatedMultiply(baseMs, attemptNumber);
                case EXPONENTIAL -> saturatedMultiply(baseMs, attemptNumber > 62 ? Long.MAX_VALUE : 1L << (attemptNumber - 1));
            };
        }
        return Duration.ofMillis(Math.min(delayMs, config.maxDelay().toMillis()));
    }
    
    private static long saturatedMultiply(long a, long b) {
        long high = Math.multiplyHigh(a, b);
        long low = a * b;
        if ((high == 0 && low >= 0) || (high == -1 && low < 0)) {
            return low;
        }
        return Long.MAX_VALUE;
    }
    
    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
    
    private void emit(RetryEvent event, RetryListener extra) {
        for (RetryListener listener : listeners) {
            notify(listener, event);
        }
        if (extra != null) {
            notify(extra, event);
        }
    }
    
    private void notify(RetryListener listener, RetryEvent event) {
        try {
            listener.onRetryEvent(event);
        } catch (RuntimeException e) {
            log.warn("Retry listener failed on {}: {}", event.type(), e.getMessage(), e);
        }
    }
}
