package com.phillippitts.agenthandoff.service.orchestration;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holder of the one current session of a context.
 *
 * <p>A session can only be installed into an empty slot, so a new persona never goes live while
 * the previous one is still current.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe and use a {@link ReentrantLock}.
 */
final class SessionSlot {

    private final Lock lock = new ReentrantLock();
    private ManagedSession current;

    /**
     * @return {@code true} if installed, {@code false} if another session is current
     */
    boolean install(ManagedSession session) {
        if (session == null) {
            throw new NullPointerException("session cannot be null");
        }
        lock.lock();
        try {
            if (current != null) {
                return false;
            }
            current = session;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the slot if it still holds {@code expected}.
     *
     * @return {@code true} if cleared
     */
    boolean release(ManagedSession expected) {
        lock.lock();
        try {
            if (current == null || current != expected) {
                return false;
            }
            current = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the slot unconditionally.
     *
     * @return the session that was current, or {@code null}
     */
    ManagedSession detach() {
        lock.lock();
        try {
            ManagedSession detached = current;
            current = null;
            return detached;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return current session, or {@code null}
     */
    ManagedSession current() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    boolean isOccupied() {
        lock.lock();
        try {
            return current != null;
        } finally {
            lock.unlock();
        }
    }
}
