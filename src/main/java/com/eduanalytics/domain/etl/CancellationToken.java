package com.eduanalytics.domain.etl;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal shared between a cancel request and the running job.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
