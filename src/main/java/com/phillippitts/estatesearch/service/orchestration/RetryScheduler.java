package com.phillippitts.estatesearch.service.orchestration;

import java.time.Duration;

/**
 * Runs a task once after a delay. Used for dispatch retry backoff.
 */
public interface RetryScheduler {

    void schedule(Runnable task, Duration delay);
}
