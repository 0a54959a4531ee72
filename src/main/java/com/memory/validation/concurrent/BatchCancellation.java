package com.memory.validation.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a running batch. Stops dispatch of further records;
 * evaluations already running are allowed to finish.
 */
public class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static BatchCancellation none() {
        return new BatchCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
