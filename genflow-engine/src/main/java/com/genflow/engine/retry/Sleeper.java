package com.genflow.engine.retry;

import java.time.Duration;

/**
 * Waits between retry attempts. Tests inject a recording or no-op sleeper.
 */
@FunctionalInterface
public interface Sleeper {
    
    void sleep(Duration duration) throws InterruptedException;
    
    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
    
    static Sleeper noop() {
        return duration -> { };
    }
}
