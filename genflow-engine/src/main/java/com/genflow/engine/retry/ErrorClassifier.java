package com.genflow.engine.retry;

import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.GenerationException.ErrorKind;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure is transient.
 *
 * <p>The cause chain is searched for, in order of precedence:
 * <ol>
 *   <li>an {@link InterruptedException}: never retried</li>
 *   <li>a {@link GenerationException}: its {@link ErrorKind} decides</li>
 *   <li>a JDK timeout or connection exception: timeout or network</li>
 *   <li>a message matching a known transient pattern</li>
 * </ol>
 * Anything else is fatal.
 */
public class ErrorClassifier {
    
    private static final int MAX_CAUSE_DEPTH = 16;
    
    public boolean isRetryable(Throwable error) {
        if (error == null || hasInterruption(error)) {
            return false;
        }
        return classify(error).map(ErrorKind::isRetryable).orElse(false);
    }
    
    /**
     * Best-effort error kind, empty when nothing in the cause chain is recognised.
     */
    public Optional<ErrorKind> classify(Throwable error) {
        for (Throwable t : causeChain(error)) {
            if (t instanceof GenerationException generationException) {
                return Optional.of(generationException.getKind());
            }
        }
        for (Throwable t : causeChain(error)) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException) {
                return Optional.of(ErrorKind.TIMEOUT);
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException
                    || t instanceof NoRouteToHostException) {
                return Optional.of(ErrorKind.NETWORK);
            }
        }
        for (Throwable t : causeChain(error)) {
            Optional<ErrorKind> kind = GenerationException.kindFromMessage(t.getMessage());
            if (kind.isPresent()) {
                return kind;
            }
        }
        return Optional.empty();
    }
    
    /**
     * Short label for logs and metric tags.
     */
    public String errorType(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        return classify(error)
            .map(kind -> kind.name().toLowerCase())
            .orElse(error.getClass().getSimpleName());
    }
    
    private boolean hasInterruption(Throwable error) {
        for (Throwable t : causeChain(error)) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }
    
    private Iterable<Throwable> causeChain(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
