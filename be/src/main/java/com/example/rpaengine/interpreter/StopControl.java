package com.example.rpaengine.interpreter;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between the executing thread and whoever may stop it.
 * {@link #sleep(long)} returns as soon as a stop is requested.
 */
public class StopControl {

    private final CountDownLatch stopped = new CountDownLatch(1);

    public void requestStop() {
        stopped.countDown();
    }

    public boolean isStopRequested() {
        return stopped.getCount() == 0;
    }

    /**
     * Waits up to {@code millis}; returns {@code true} if the full delay elapsed, {@code false} if
     * interrupted by a stop request.
     */
    public boolean sleep(long millis) {
        if (millis <= 0) {
            return !isStopRequested();
        }
        try {
            return !stopped.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop();
            return false;
        }
    }
}
