package com.genflow.core.model;

/**
 * Step counts by status plus the current step pointer.
 */
public record WorkflowProgress(
    int total,
    int pending,
    int inProgress,
    int completed,
    int skipped,
    String current
) {
    public int terminal() {
        return completed + skipped;
    }

    public boolean isComplete() {
        return terminal() == total;
    }
}
