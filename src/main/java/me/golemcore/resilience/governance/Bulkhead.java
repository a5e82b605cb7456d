package me.golemcore.resilience.governance;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.resilience.domain.model.BulkheadState;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded concurrency with a FIFO wait queue for one target.
 *
 * <p>
 * Admission rules:
 * <ul>
 * <li>If a slot is free and nobody is queued, the caller is admitted
 * immediately</li>
 * <li>Otherwise the caller joins the tail of the queue and waits up to
 * {@code waitTimeout}</li>
 * <li>A released slot is handed directly to the head waiter, so
 * {@code inFlight} never exceeds {@code capacity} and arriving callers cannot
 * barge ahead of the queue</li>
 * </ul>
 *
 * <p>
 * Granting a slot to a waiter and removing that waiter on timeout or interrupt
 * both happen under the same lock. A waiter that wakes at the timeout boundary
 * re-checks its grant flag before leaving, so a slot handed over at that
 * instant is neither lost nor granted twice.
 *
 * @since 1.0
 * @see BulkheadPermit
 */
public class Bulkhead {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int inFlight;

    public Bulkhead(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Acquire a slot, waiting up to {@code waitTimeout} behind earlier callers.
     *
     * @return the permit, or empty if the wait timed out
     * @throws InterruptedException
     *             if the caller was interrupted while queued; the caller is
     *             removed from the queue and holds no slot
     */
    public Optional<BulkheadPermit> acquire(Duration waitTimeout) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (inFlight < capacity && waiters.isEmpty()) {
                inFlight++;
                return Optional.of(new BulkheadPermit(this));
            }

            long remainingNanos = waitTimeout.toNanos();
            if (remainingNanos <= 0) {
                return Optional.empty();
            }

            Waiter waiter = new Waiter(lock.newCondition());
            waiters.addLast(waiter);
            try {
                while (!waiter.granted && remainingNanos > 0) {
                    remainingNanos = waiter.condition.awaitNanos(remainingNanos);
                }
            } catch (InterruptedException e) {
                if (waiter.granted) {
                    releaseLocked();
                } else {
                    waiters.remove(waiter);
                }
                throw e;
            }

            if (waiter.granted) {
                return Optional.of(new BulkheadPermit(this));
            }
            waiters.remove(waiter);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    void release() {
        lock.lock();
        try {
            releaseLocked();
        } finally {
            lock.unlock();
        }
    }

    private void releaseLocked() {
        Waiter next = waiters.pollFirst();
        if (next != null) {
            // slot passes to the head waiter, inFlight unchanged
            next.granted = true;
            next.condition.signal();
            return;
        }
        if (inFlight > 0) {
            inFlight--;
        }
    }

    public BulkheadState getState(String target) {
        lock.lock();
        try {
            return BulkheadState.builder()
                    .target(target)
                    .capacity(capacity)
                    .inFlight(inFlight)
                    .queued(waiters.size())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private static final class Waiter {
        private final Condition condition;
        private boolean granted;

        private Waiter(Condition condition) {
            this.condition = condition;
        }
    }
}
