package com.genflow.engine.retry;

import com.genflow.core.model.RetryEvent;

@FunctionalInterface
public interface RetryListener {
    
    void onRetryEvent(RetryEvent event);
}
