package com.genflow.core.generation;

import java.util.Locale;
import java.util.Optional;

/**
 * Exception thrown by the generation backend.
 * The {@link ErrorKind} decides whether the call may be retried.
 */
public class GenerationException extends Exception {
    
    /**
     * Failure classes reported by a generation backend.
     */
    public enum ErrorKind {
        TIMEOUT(true),
        RATE_LIMIT(true),
        NETWORK(true),
        AUTH_FAILURE(false),
        INVALID_RESPONSE(false);
        
        private final boolean retryable;
        
        ErrorKind(boolean retryable) {
            this.retryable = retryable;
        }
        
        public boolean isRetryable() {
            return retryable;
        }
    }
    
    private final ErrorKind kind;
    
    public GenerationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public GenerationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    public boolean isRetryable() {
        return kind.isRetryable();
    }
    
    public static GenerationException timeout(String message) {
        return new GenerationException(ErrorKind.TIMEOUT, message);
    }
    
    public static GenerationException rateLimit(String message) {
        return new GenerationException(ErrorKind.RATE_LIMIT, message);
    }
    
    public static GenerationException network(String message) {
        return new GenerationException(ErrorKind.NETWORK, message);
    }
    
    public static GenerationException authFailure(String message) {
        return new GenerationException(ErrorKind.AUTH_FAILURE, message);
    }
    
    public static GenerationException invalidResponse(String message) {
        return new GenerationException(ErrorKind.INVALID_RESPONSE, message);
    }
    
    /**
     * Wrap an arbitrary error, guessing its kind from the message.
     * Anything unrecognised is reported as an invalid response, which is not retried.
     */
    public static GenerationException from(Throwable error) {
        if (error instanceof GenerationException generationException) {
            return generationException;
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new GenerationException(kindFromMessage(message).orElse(ErrorKind.INVALID_RESPONSE), message, error);
    }
    
    /**
     * Match the well-known transport and backend failure messages.
     */
    public static Optional<ErrorKind> kindFromMessage(String message) {
        if (message == null) {
            return Optional.empty();
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return Optional.of(ErrorKind.TIMEOUT);
        }
        if (lower.contains("rate limit") || lower.contains("429")) {
            return Optional.of(ErrorKind.RATE_LIMIT);
        }
        if (lower.contains("network") || lower.contains("econnrefused")
                || lower.contains("enotfound") || lower.contains("fetch failed")) {
            return Optional.of(ErrorKind.NETWORK);
        }
        if (lower.contains("401") || lower.contains("unauthorized") || lower.contains("invalid api key")) {
            return Optional.of(ErrorKind.AUTH_FAILURE);
        }
        return Optional.empty();
    }
}
