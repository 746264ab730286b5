package com.eainde.auditor.extraction;

import java.time.Duration;

/**
 * Blocking wait used between attempts. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
