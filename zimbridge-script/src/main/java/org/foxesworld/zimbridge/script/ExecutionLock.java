package org.foxesworld.zimbridge.script;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The single lock guarding entry into the script context. A JS context admits one thread at a
 * time; every host thread that touches a guest value goes through here first.
 *
 * <p>Re-entrant: a guest call that calls back into host code which dispatches into the guest
 * again does not deadlock.</p>
 */
public final class ExecutionLock {

    private final ReentrantLock lock = new ReentrantLock();

    /** Blocks until the lock is held. Use with try-with-resources. */
    public Scope enter() {
        lock.lock();
        return new Scope(lock);
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public int holdCount() {
        return lock.getHoldCount();
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    public static final class Scope implements AutoCloseable {
        private final ReentrantLock lock;
        private boolean open = true;

        private Scope(ReentrantLock lock) {
            this.lock = lock;
        }

        @Override
        public void close() {
            if (!open) return;
            open = false;
            lock.unlock();
        }
    }
}
