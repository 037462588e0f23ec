package io.github.vishalmysore.evolution.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation handle for a run. Cancelling stops dispatch of further chunks;
 * chunks already running finish and their links are kept.
 */
public class RunControl {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
