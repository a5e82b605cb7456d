package me.golemcore.resilience.adapter.outbound.otlp;

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

import me.golemcore.resilience.domain.model.ExportDropReason;
import me.golemcore.resilience.domain.model.MetricsSnapshot;
import me.golemcore.resilience.port.outbound.MetricsEncoder;
import me.golemcore.resilience.port.outbound.MetricsSenderPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded queue of metrics snapshots drained by a single background worker.
 *
 * <p>
 * Producers call {@link #tryEnqueue(MetricsSnapshot)}, which never blocks and
 * returns false when the queue is at capacity. The worker takes the earliest
 * due item (by {@code notBeforeTime}, then arrival order), encodes it and hands
 * it to the {@link MetricsSenderPort}.
 *
 * <p>
 * Retry policy: after the n-th failed send the item is rescheduled
 * {@code min(base * 2^(n-1), max)} ms later. Once the failure count exceeds
 * {@code maxAttempts} the item is dropped. With base=500, max=8000 and
 * maxAttempts=3 the delays are 500, 1000 and 2000 ms, and the fourth failure
 * drops the item.
 *
 * <p>
 * Retried items are re-inserted even when new snapshots have filled the queue
 * meanwhile, so the queue holds at most {@code capacity + 1} items.
 *
 * @since 1.0
 * @see OtlpMetricsExporter
 */
@Slf4j
public class ExportQueue implements AutoCloseable {

    private static final long WORKER_POLL_MS = 1000;
    private static final int MAX_BACKOFF_SHIFT = 30;

    private final int capacity;
    private final int maxAttempts;
    private final long retryBaseMs;
    private final long retryMaxMs;
    private final MetricsEncoder encoder;
    private final MetricsSenderPort sender;
    private final ExportDropListener dropListener;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<ExportItem> items = new PriorityQueue<>(ExportItem.SCHEDULE_ORDER);
    private long nextSequence;
    private boolean closed;
    private Thread worker;

    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong queueFullDrops = new AtomicLong();
    private final AtomicLong retriesExhaustedDrops = new AtomicLong();

    public ExportQueue(int capacity, int maxAttempts, long retryBaseMs, long retryMaxMs, MetricsEncoder encoder,
            MetricsSenderPort sender, ExportDropListener dropListener, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (retryBaseMs < 0 || retryMaxMs < 0) {
            throw new IllegalArgumentException("retry delays must be >= 0");
        }
        this.capacity = capacity;
        this.maxAttempts = maxAttempts;
        this.retryBaseMs = retryBaseMs;
        this.retryMaxMs = retryMaxMs;
        this.encoder = encoder;
        this.sender = sender;
        this.dropListener = dropListener;
        this.clock = clock;
    }

    /**
     * Queue a snapshot for export without blocking.
     *
     * @return false if the queue is full or closed; the snapshot is dropped
     */
    public boolean tryEnqueue(MetricsSnapshot snapshot) {
        lock.lock();
        try {
            if (!closed && items.size() < capacity) {
                items.add(new ExportItem(snapshot, nextSequence++, clock.instant()));
                changed.signalAll();
                return true;
            }
        } finally {
            lock.unlock();
        }
        queueFullDrops.incrementAndGet();
        dropListener.onDrop(ExportDropReason.QUEUE_FULL, snapshot, 0);
        return false;
    }

    /**
     * Start the background worker. Calling it twice is a no-op.
     */
    public void start() {
        lock.lock();
        try {
            if (worker != null || closed) {
                return;
            }
            worker = new Thread(this::runWorker, "otlp-export-worker");
            worker.setDaemon(true);
            worker.start();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Send at most one due item, waiting up to {@code maxWaitMs} for one to
     * become due.
     *
     * @return true if an item was sent (successfully or not)
     */
    boolean processNext(long maxWaitMs) throws InterruptedException {
        ExportItem item = takeDue(maxWaitMs);
        if (item == null) {
            return false;
        }
        deliver(item);
        return true;
    }

    private ExportItem takeDue(long maxWaitMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(maxWaitMs);
        lock.lock();
        try {
            while (true) {
                ExportItem head = items.peek();
                long now = clock.millis();
                if (head != null && head.getNotBeforeTime().toEpochMilli() <= now) {
                    return items.poll();
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || closed) {
                    return null;
                }
                long wait = head == null
                        ? remaining
                        : Math.min(remaining,
                                TimeUnit.MILLISECONDS.toNanos(head.getNotBeforeTime().toEpochMilli() - now));
                changed.awaitNanos(wait);
            }
        } finally {
            lock.unlock();
        }
    }

    private void deliver(ExportItem item) {
        boolean delivered;
        try {
            delivered = sender.send(encoder.encode(item.getSnapshot()));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) { // NOSONAR - sender errors count as failed sends
            log.warn("[OtlpExport] Send failed: {}", e.toString());
            delivered = false;
        }
        if (delivered) {
            sentCount.incrementAndGet();
            return;
        }

        int attempts = item.getAttemptCount() + 1;
        if (attempts > maxAttempts) {
            retriesExhaustedDrops.incrementAndGet();
            dropListener.onDrop(ExportDropReason.RETRIES_EXHAUSTED, item.getSnapshot(), attempts);
            return;
        }
        long delayMs = computeDelayMs(attempts);
        item.scheduleRetry(attempts, clock.instant().plusMillis(delayMs));
        log.debug("[OtlpExport] Attempt {} failed, retrying in {}ms", attempts, delayMs);

        lock.lock();
        try {
            items.add(item);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Backoff delay scheduled after the given number of failed sends.
     */
    long computeDelayMs(int failedAttempts) {
        int shift = Math.min(Math.max(failedAttempts - 1, 0), MAX_BACKOFF_SHIFT);
        long delay = retryBaseMs << shift;
        if (delay < 0 || delay > retryMaxMs) {
            return retryMaxMs;
        }
        return delay;
    }

    private void runWorker() {
        log.info("[OtlpExport] Worker started");
        while (!isClosed()) {
            try {
                processNext(WORKER_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("[OtlpExport] Worker iteration failed", e);
            }
        }
        log.info("[OtlpExport] Worker stopped ({} items left unsent)", size());
    }

    private boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop the worker. Items still queued are discarded.
     */
    @Override
    public void close() {
        Thread running;
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
            running = worker;
        } finally {
            lock.unlock();
        }
        if (running != null && running != Thread.currentThread()) {
            running.interrupt();
            try {
                running.join(TimeUnit.SECONDS.toMillis(2));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Copies of the queued items in the order the worker will take them.
     */
    public List<ExportItem> pendingItems() {
        lock.lock();
        try {
            List<ExportItem> copies = new ArrayList<>(items.size());
            items.forEach(item -> copies.add(item.copy()));
            copies.sort(ExportItem.SCHEDULE_ORDER);
            return copies;
        } finally {
            lock.unlock();
        }
    }

    public long getSentCount() {
        return sentCount.get();
    }

    public long getQueueFullDrops() {
        return queueFullDrops.get();
    }

    public long getRetriesExhaustedDrops() {
        return retriesExhaustedDrops.get();
    }
}
