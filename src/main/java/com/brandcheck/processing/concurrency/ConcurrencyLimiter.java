package com.brandcheck.processing.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds the number of tasks executing at once across a whole batch run.
 * <p>
 * Tasks beyond the limit wait in an unbounded FIFO queue; when a running task finishes its slot is
 * handed to the longest-waiting task. Waiting tasks hold no thread. The in-flight counter and the
 * waiter queue are only touched under {@link #lock}.
 * <p>
 * One instance is shared by every document of a run. Creating a limiter per document would let the
 * batch exceed its global budget.
 */
public class ConcurrencyLimiter {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final int limit;
    private final Executor executor;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Runnable> waiting = new ArrayDeque<>();
    private int inFlight;
    private int peakInFlight;

    public ConcurrencyLimiter(int limit, Executor executor) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        this.limit = limit;
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    /**
     * Schedules {@code fn} to run once a slot is free.
     *
     * @return future completed with the task's value, or exceptionally with whatever it threw
     */
    public <T> CompletableFuture<T> run(Callable<T> fn) {
        Objects.requireNonNull(fn, "fn is required");
        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable task = () -> execute(fn, result);

        boolean admitted;
        lock.lock();
        try {
            admitted = inFlight < limit;
            if (admitted) {
                admit();
            } else {
                waiting.addLast(task);
            }
        } finally {
            lock.unlock();
        }

        if (admitted) {
            dispatch(task);
        }
        return result;
    }

    public int getLimit() {
        return limit;
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    public int queued() {
        lock.lock();
        try {
            return waiting.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Highest number of tasks observed running at the same time.
     */
    public int peakInFlight() {
        lock.lock();
        try {
            return peakInFlight;
        } finally {
            lock.unlock();
        }
    }

    private <T> void execute(Callable<T> fn, CompletableFuture<T> result) {
        try {
            result.complete(fn.call());
        } catch (Exception e) {
            result.completeExceptionally(e);
        } catch (Error e) {
            result.completeExceptionally(e);
            throw e;
        } finally {
            release();
        }
    }

    /**
     * Frees the finished task's slot and passes it straight to the next waiter, if any.
     */
    private void release() {
        Runnable next;
        lock.lock();
        try {
            inFlight--;
            next = waiting.pollFirst();
            if (next != null) {
                admit();
            }
        } finally {
            lock.unlock();
        }

        if (next != null) {
            dispatch(next);
        }
    }

    // caller holds lock
    private void admit() {
        inFlight++;
        if (inFlight > peakInFlight) {
            peakInFlight = inFlight;
        }
    }

    private void dispatch(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            // Run on the caller rather than leak the slot; the task still releases it when done
            logger.warn("Executor rejected limiter task, running on caller thread: {}", e.getMessage());
            task.run();
        }
    }
}
