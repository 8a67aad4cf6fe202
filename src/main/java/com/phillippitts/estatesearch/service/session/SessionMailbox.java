package com.phillippitts.estatesearch.service.session;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Serial task queue for one session.
 *
 * <p>Tasks submitted from any thread run one at a time, in submission order, on the shared
 * executor. At most one drain loop is active per mailbox, so different sessions proceed in
 * parallel while a single session never sees two tasks at once. A task that submits to its
 * own mailbox enqueues behind itself rather than running nested.
 *
 * <p>A task counts as unfinished from {@link #submit(Runnable)} until it has run. Once
 * {@link #closeIfIdle(BooleanSupplier)} succeeds the mailbox accepts nothing further.
 *
 * <p>While draining, {@code sessionId} is placed in the Log4j2 {@code ThreadContext}.
 */
public final class SessionMailbox {

    private static final Logger LOG = LogManager.getLogger(SessionMailbox.class);

    private final String sessionId;
    private final Executor executor;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicInteger unfinished = new AtomicInteger();
    private boolean closed; // guarded by this

    public SessionMailbox(String sessionId, Executor executor) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Queues a task behind everything already submitted.
     *
     * @return {@code false} if the mailbox is closed and the task was not queued
     */
    public boolean submit(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (this) {
            if (closed) {
                return false;
            }
            unfinished.incrementAndGet();
            queue.add(task);
        }
        scheduleDrain();
        return true;
    }

    /** Tasks submitted and not yet completed, including one that is running. */
    public int unfinishedTasks() {
        return unfinished.get();
    }

    /**
     * Closes the mailbox if no task is queued or running and {@code idle} holds. The check
     * and the close are atomic with respect to {@link #submit(Runnable)}.
     *
     * @return {@code true} if this call closed the mailbox
     */
    public synchronized boolean closeIfIdle(BooleanSupplier idle) {
        if (closed || unfinished.get() > 0 || !idle.getAsBoolean()) {
            return false;
        }
        closed = true;
        return true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            throw e;
        }
    }

    private void drain() {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            Runnable task;
            while ((task = queue.poll()) != null) {
                runTask(task);
            }
        } finally {
            draining.set(false);
        }
        // A submit may have raced with the flag reset
        if (!queue.isEmpty()) {
            scheduleDrain();
        }
    }

    private void runTask(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Session task failed for session {}; continuing with next task", sessionId, e);
        } finally {
            unfinished.decrementAndGet();
        }
    }
}
