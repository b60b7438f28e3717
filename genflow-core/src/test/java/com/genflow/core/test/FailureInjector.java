package com.genflow.core.test;

import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.StepGenerator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Failure injection for step generators.
 * Failures are either scripted per step (fail the next N calls with a given error)
 * or drawn at random with a fixed seed for reproducible chaos tests.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * FailureInjector injector = new FailureInjector();
 * injector.failNext("prd", () -> GenerationException.network("connection reset"));
 *
 * StepGenerator flaky = injector.wrap(realGenerator);
 * // first call for "prd" throws, the second one delegates
 * }</pre>
 */
public class FailureInjector {

    private final Map<String, Deque<Supplier<? extends Exception>>> scripted = new ConcurrentHashMap<>();
    private final Map<String, Supplier<? extends Exception>> permanent = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final double failureRate;
    private final Random random;

    public FailureInjector() {
        this(0.0, 0L);
    }

    /**
     * Random failures (retryable network errors) at the given rate.
     */
    public FailureInjector(double failureRate, long seed) {
        if (failureRate < 0.0 || failureRate > 1.0) {
            throw new IllegalArgumentException("Failure rate must be between 0.0 and 1.0");
        }
        this.failureRate = failureRate;
        this.random = new Random(seed);
    }

    /**
     * Fail the next call for the step with the supplied error.
     */
    public FailureInjector failNext(String stepId, Supplier<? extends Exception> error) {
        return failTimes(stepId, 1, error);
    }

    /**
     * Fail the next {@code times} calls for the step with the supplied error.
     */
    public FailureInjector failTimes(String stepId, int times, Supplier<? extends Exception> error) {
        Deque<Supplier<? extends Exception>> queue = scripted.computeIfAbsent(stepId, k -> new ArrayDeque<>());
        synchronized (queue) {
            for (int i = 0; i < times; i++) {
                queue.addLast(error);
            }
        }
        return this;
    }

    /**
     * Fail every call for the step.
     */
    public FailureInjector failAlways(String stepId, Supplier<? extends Exception> error) {
        permanent.put(stepId, error);
        return this;
    }

    /**
     * Wrap a generator so that injected failures fire before it is called.
     */
    public StepGenerator wrap(StepGenerator delegate) {
        return context -> {
            String stepId = context.getStepId();
            invocations.computeIfAbsent(stepId, k -> new AtomicInteger()).incrementAndGet();
            maybeThrow(stepId);
            return delegate.generate(context);
        };
    }

    /**
     * Throw the next injected failure for the step, if any.
     */
    public void maybeThrow(String stepId) throws GenerationException {
        Supplier<? extends Exception> error = nextFailure(stepId);
        if (error == null) {
            return;
        }
        failureCount.incrementAndGet();
        Exception exception = error.get();
        if (exception instanceof GenerationException generationException) {
            throw generationException;
        }
        if (exception instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        throw new IllegalStateException("Unsupported injected failure", exception);
    }

    private Supplier<? extends Exception> nextFailure(String stepId) {
        Supplier<? extends Exception> always = permanent.get(stepId);
        if (always != null) {
            return always;
        }
        Deque<Supplier<? extends Exception>> queue = scripted.get(stepId);
        if (queue != null) {
            synchronized (queue) {
                if (!queue.isEmpty()) {
                    return queue.pollFirst();
                }
            }
        }
        synchronized (random) {
            if (failureRate > 0 && random.nextDouble() < failureRate) {
                return () -> GenerationException.network("Injected network failure");
            }
        }
        return null;
    }

    /**
     * Number of times the wrapped generator was invoked for the step, failures included.
     */
    public int getInvocationCount(String stepId) {
        AtomicInteger count = invocations.get(stepId);
        return count == null ? 0 : count.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public void reset() {
        scripted.clear();
        permanent.clear();
        invocations.clear();
        failureCount.set(0);
    }
}
