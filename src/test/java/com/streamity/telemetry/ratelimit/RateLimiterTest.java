package com.streamity.telemetry.ratelimit;

import com.streamity.telemetry.metrics.NoOpMetrics;
import com.streamity.telemetry.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.streamity.telemetry.testutil.TestFactory.BASE;
import static org.assertj.core.api.Assertions.assertThat;

public class RateLimiterTest {

    private final MutableClock clock = new MutableClock(BASE);
    private final InMemoryRateLimitCounterStore store = new InMemoryRateLimitCounterStore();
    private final RateLimiter limiter = new RateLimiter(store, clock, new NoOpMetrics(), 60, 10);

    @Test
    void testAdmitsUpToCeilingThenDenies() {
        for (int i = 1; i <= 10; i++) {
            assertThat(limiter.admit("10.0.0.1")).as("request %d", i).isTrue();
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(limiter.admit("10.0.0.1")).isFalse();
    }

    @Test
    void testFirstRequestCreatesCounter() {
        assertThat(store.find("10.0.0.1")).isEmpty();

        limiter.admit("10.0.0.1");

        RateLimitCounter counter = store.find("10.0.0.1").orElseThrow();
        assertThat(counter.count()).isEqualTo(1);
        assertThat(counter.windowStart()).isEqualTo(BASE);
    }

    /**
     * Denied requests must not push the counter past the ceiling.
     */
    @Test
    void testDenialDoesNotIncrement() {
        for (int i = 0; i < 15; i++) {
            limiter.admit("10.0.0.1");
        }

        assertThat(store.find("10.0.0.1").orElseThrow().count()).isEqualTo(10);
    }

    @Test
    void testWindowResetsAfterExpiry() {
        for (int i = 0; i < 11; i++) {
            limiter.admit("10.0.0.1");
        }
        assertThat(limiter.admit("10.0.0.1")).isFalse();

        clock.advance(Duration.ofSeconds(61));

        assertThat(limiter.admit("10.0.0.1")).isTrue();
        RateLimitCounter counter = store.find("10.0.0.1").orElseThrow();
        assertThat(counter.count()).isEqualTo(1);
        assertThat(counter.windowStart()).isEqualTo(BASE.plusSeconds(61));
    }

    /**
     * The window only expires once strictly more than 60 seconds have passed.
     */
    @Test
    void testWindowBoundaryIsExclusive() {
        for (int i = 0; i < 10; i++) {
            limiter.admit("10.0.0.1");
        }

        clock.advance(Duration.ofSeconds(60));
        assertThat(limiter.admit("10.0.0.1")).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(limiter.admit("10.0.0.1")).isTrue();
    }

    @Test
    void testIdentitiesAreIndependent() {
        for (int i = 0; i < 10; i++) {
            limiter.admit("10.0.0.1");
        }

        assertThat(limiter.admit("10.0.0.1")).isFalse();
        assertThat(limiter.admit("10.0.0.2")).isTrue();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void testMissingIdentitySharesUnknownBucket() {
        assertThat(limiter.admit(null)).isTrue();
        assertThat(limiter.admit("  ")).isTrue();
        assertThat(limiter.admit("not an address\r\n")).isTrue();

        assertThat(store.find("unknown").orElseThrow().count()).isEqualTo(3);
    }

    @Test
    void testConcurrentRequestsOfOneIdentityNeverExceedCeiling() throws Exception {
        int threads = 16;
        int requestsPerThread = 5;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                Callable<Integer> task = () -> {
                    start.await();
                    int admitted = 0;
                    for (int i = 0; i < requestsPerThread; i++) {
                        if (limiter.admit("10.0.0.9")) {
                            admitted++;
                        }
                    }
                    return admitted;
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int total = 0;
            for (Future<Integer> f : results) {
                total += f.get();
            }
            assertThat(total).isEqualTo(10);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testZeroCeilingDeniesEverything() {
        RateLimiter closed = new RateLimiter(store, clock, new NoOpMetrics(), 60, 0);

        assertThat(closed.admit("10.0.0.1")).isFalse();
        assertThat(store.find("10.0.0.1")).isEmpty();
    }
}
