package com.eainde.auditor.extraction;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Caps the number of generator calls in flight across every node of a run.
 */
@Slf4j
public class CallLimiter {

    private final Semaphore permits;
    private final int maxConcurrent;

    public CallLimiter(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        this.maxConcurrent = maxConcurrent;
        this.permits = new Semaphore(maxConcurrent, true);
    }

    public static CallLimiter unbounded() {
        return new CallLimiter(Integer.MAX_VALUE);
    }

    public <T> T call(Callable<T> call) throws Exception {
        if (!permits.tryAcquire()) {
            log.debug("All {} generator permits taken, waiting", maxConcurrent);
            permits.acquire();
        }
        try {
            return call.call();
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }
}
