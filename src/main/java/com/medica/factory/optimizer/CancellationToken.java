package com.medica.factory.optimizer;

/**
 * Cooperative stop flag shared between a caller and a running search.
 * Searches poll it between generations or iterations.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
