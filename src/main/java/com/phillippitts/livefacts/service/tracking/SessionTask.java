package com.phillippitts.livefacts.service.tracking;

import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation handle for one background task of a tracking session.
 *
 * <p>{@link Future#cancel(boolean)} only reports that cancellation was requested; it does
 * not wait for the task's {@code finally} blocks. This handle adds a settlement latch that
 * is released once the task body has returned (or once the task was cancelled before it
 * ever started), so callers can wait until the task has really stopped.
 *
 * <p>The {@code onSettled} hook runs exactly once, after the latch is released. Cleanup
 * that needs a lock held by a thread waiting in {@link #awaitSettled} belongs there.
 */
public final class SessionTask {

    private final String name;
    private final CountDownLatch settled = new CountDownLatch(1);
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private final Runnable onSettled;
    private volatile Future<?> future;

    private SessionTask(String name, Runnable onSettled) {
        this.name = name;
        this.onSettled = onSettled;
    }

    /**
     * Submits {@code body} to {@code executor}.
     *
     * @param onSettled cleanup run once the task has settled, on whichever thread settled it
     * @throws java.util.concurrent.RejectedExecutionException if the executor rejects the task
     */
    public static SessionTask spawn(String name, AsyncTaskExecutor executor, Runnable body, Runnable onSettled) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(onSettled, "onSettled");
        SessionTask task = new SessionTask(name, onSettled);
        task.future = executor.submit(() -> {
            if (!task.claimed.compareAndSet(false, true)) {
                return; // cancelled before start
            }
            try {
                body.run();
            } finally {
                task.settle();
            }
        });
        return task;
    }

    /**
     * Requests cancellation, interrupting the task if it is running. Idempotent.
     */
    public void cancel() {
        if (claimed.compareAndSet(false, true)) {
            settle();
        }
        Future<?> f = future;
        if (f != null) {
            f.cancel(true);
        }
    }

    /**
     * Waits until the task body has returned.
     *
     * @return {@code true} if the task settled within the timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitSettled(Duration timeout) throws InterruptedException {
        return settled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Cancels the task and waits for it to settle, swallowing the expected outcome.
     *
     * @return {@code true} if the task settled within the timeout
     */
    public boolean cancelAndAwait(Duration timeout) {
        cancel();
        try {
            return awaitSettled(timeout);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void settle() {
        settled.countDown();
        onSettled.run();
    }

    public boolean isSettled() {
        return settled.getCount() == 0;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "SessionTask[" + name + (isSettled() ? ", settled" : "") + ']';
    }
}
