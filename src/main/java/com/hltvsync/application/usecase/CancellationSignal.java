package com.hltvsync.application.usecase;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops a run from starting new units. Units already in flight finish and checkpoint.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
