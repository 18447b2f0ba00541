package podpilot.controlplane.core;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The single process-wide critical section guarding all cluster state.
 *
 * Every registry operation, placement, sweep and snapshot runs inside
 * {@link #call} or {@link #run}. The lock is reentrant so a sweep may call
 * into the scheduler, which acquires it again.
 */
public final class ClusterLock {

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Run an action holding the lock and return its result.
     */
    public <T> T call(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run an action holding the lock.
     */
    public void run(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
