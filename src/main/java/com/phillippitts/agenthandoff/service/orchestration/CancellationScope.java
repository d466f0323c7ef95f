package com.phillippitts.agenthandoff.service.orchestration;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared cancellation for the tasks of one synthesis cycle: the synthesis worker, its timeout
 * ceiling and the engagement loop.
 *
 * <p>Side effects that must not happen after cancellation (filler utterances) run through
 * {@link #runIfActive(Runnable)} under the read lock. {@link #cancel()} takes the write lock, so
 * once it returns no such side effect is in progress and none will start.
 *
 * <p>{@link #cancel()} must not be called from inside {@link #runIfActive(Runnable)}.
 */
final class CancellationScope {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    /**
     * Ties a future to this scope. A future registered after cancellation is cancelled at once.
     */
    void register(Future<?> future) {
        futures.add(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    /**
     * Cancels the scope and every registered future, interrupting running ones.
     *
     * @return true if this call cancelled the scope, false if it was already cancelled
     */
    boolean cancel() {
        lock.writeLock().lock();
        try {
            if (cancelled) {
                return false;
            }
            cancelled = true;
        } finally {
            lock.writeLock().unlock();
        }
        for (Future<?> future : futures) {
            future.cancel(true);
        }
        return true;
    }

    /**
     * Runs the action unless the scope is cancelled; cancellation waits for it to finish.
     *
     * @return true if the action ran
     */
    boolean runIfActive(Runnable action) {
        lock.readLock().lock();
        try {
            if (cancelled) {
                return false;
            }
            action.run();
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean isCancelled() {
        return cancelled;
    }
}
