package com.brandcheck.processing.concurrency;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ConcurrencyLimiter.
 * Tests the global bound, FIFO admission and slot release on failure.
 */
class ConcurrencyLimiterTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testNeverExceedsLimitWithFiftyTasksQueuedUpfront() {
        // Given: a limiter of 5 and 50 tasks recording how many run at once
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(5, executor);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger observedPeak = new AtomicInteger();

        // When: all 50 tasks are submitted before any completes
        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            int id = i;
            futures.add(limiter.run(() -> {
                int now = running.incrementAndGet();
                observedPeak.accumulateAndGet(now, Math::max);
                Thread.sleep(20);
                running.decrementAndGet();
                return id;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // Then: at most 5 ran simultaneously and every task completed
        assertThat(observedPeak.get()).isLessThanOrEqualTo(5);
        assertThat(limiter.peakInFlight()).isEqualTo(5);
        assertThat(futures).allMatch(f -> f.isDone() && !f.isCompletedExceptionally());
        assertThat(limiter.inFlight()).isZero();
        assertThat(limiter.queued()).isZero();
    }

    @Test
    void testWaitingTasksAreAdmittedInSubmissionOrder() throws Exception {
        // Given: a limiter of 1 whose only slot is held by a blocked task
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(1, executor);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Boolean> blocker = limiter.run(() -> release.await(5, TimeUnit.SECONDS));

        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Boolean>> waiting = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            int id = i;
            waiting.add(limiter.run(() -> order.add(id)));
        }
        assertThat(limiter.queued()).isEqualTo(10);

        // When: the slot is released
        release.countDown();
        blocker.join();
        CompletableFuture.allOf(waiting.toArray(new CompletableFuture[0])).join();

        // Then: waiters ran in the order they were submitted
        assertThat(order).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
    }

    @Test
    void testFailedTaskReleasesItsSlot() {
        // Given: a limiter of 1
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(1, executor);

        // When: the first task throws
        CompletableFuture<String> failing = limiter.run(() -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = limiter.run(() -> "ok");

        // Then: the error reaches the caller and the next task still runs
        assertThatThrownBy(failing::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(next.join()).isEqualTo("ok");
        assertThat(limiter.inFlight()).isZero();
    }

    @Test
    void testRejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new ConcurrencyLimiter(0, executor))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
