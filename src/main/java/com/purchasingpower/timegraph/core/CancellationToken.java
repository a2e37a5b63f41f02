package com.purchasingpower.timegraph.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal. Long traversals check it between hops and the chunked
 * analyzer between windows; both then return what they have with a cancelled marker.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
