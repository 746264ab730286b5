package com.eainde.auditor.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallLimiterTest {

    @Test
    @DisplayName("should never let more calls run than it has permits")
    void boundsConcurrency() throws Exception {
        CallLimiter limiter = new CallLimiter(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(6);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            for (int i = 0; i < 6; i++) {
                pool.execute(() -> {
                    try {
                        limiter.call(() -> {
                            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                            Thread.sleep(50);
                            return inFlight.decrementAndGet();
                        });
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(limiter.availablePermits()).isEqualTo(2);
    }

    @Test
    @DisplayName("should release its permit when the call fails")
    void releasesOnFailure() {
        CallLimiter limiter = new CallLimiter(1);

        assertThatThrownBy(() -> limiter.call(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(limiter.availablePermits()).isEqualTo(1);
    }
}
