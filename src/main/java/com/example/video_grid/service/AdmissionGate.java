package com.example.video_grid.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting gate that bounds how many jobs are past admission at once. Unlike a plain
 * {@link java.util.concurrent.Semaphore} it can be closed, which fails every current and future
 * waiter until {@link #reopen()}, and it keeps counters the concurrency tests assert on.
 */
public class AdmissionGate {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionGate.class);

    private final int permits;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private int inUse;
    private int waiting;
    private boolean closed;
    private long acquiredCount;
    private long releasedCount;
    private int peakInUse;

    public AdmissionGate(int permits) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive: " + permits);
        }
        this.permits = permits;
    }

    /**
     * Blocks until a slot is free.
     *
     * @return {@code false} without holding a slot when the gate was closed, the token got
     * cancelled or the thread was interrupted while waiting.
     */
    public boolean acquire(CancellationToken token) {
        lock.lock();
        try {
            waiting++;
            try {
                while (!closed && !token.isCancelled() && inUse >= permits) {
                    changed.await();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } finally {
                waiting--;
            }
            if (closed || token.isCancelled()) {
                return false;
            }
            inUse++;
            acquiredCount++;
            peakInUse = Math.max(peakInUse, inUse);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void release() {
        lock.lock();
        try {
            if (inUse == 0) {
                LOGGER.warn("GATE release without matching acquire");
                return;
            }
            inUse--;
            releasedCount++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Makes waiters re-check their cancellation tokens. */
    public void wakeWaiters() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Fails every waiter and every later {@link #acquire} until reopened. Held slots stay held. */
    public void cancelAll() {
        lock.lock();
        try {
            closed = true;
            LOGGER.debug("GATE closed waiting={} inUse={}", waiting, inUse);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void reopen() {
        lock.lock();
        try {
            closed = false;
        } finally {
            lock.unlock();
        }
    }

    public int permits() {
        return permits;
    }

    public int inUse() {
        lock.lock();
        try {
            return inUse;
        } finally {
            lock.unlock();
        }
    }

    public int waiting() {
        lock.lock();
        try {
            return waiting;
        } finally {
            lock.unlock();
        }
    }

    public long acquiredCount() {
        lock.lock();
        try {
            return acquiredCount;
        } finally {
            lock.unlock();
        }
    }

    public long releasedCount() {
        lock.lock();
        try {
            return releasedCount;
        } finally {
            lock.unlock();
        }
    }

    public int peakInUse() {
        lock.lock();
        try {
            return peakInUse;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
