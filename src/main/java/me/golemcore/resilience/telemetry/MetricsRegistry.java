package me.golemcore.resilience.telemetry;

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

import me.golemcore.resilience.domain.model.MetricsSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide counters and gauges.
 *
 * <p>
 * Writers (increments, gauge updates) share the read side of a
 * {@link ReadWriteLock} and update lock-free atomics, so they never block each
 * other. {@link #snapshot()} takes the write side, so a snapshot is a
 * consistent point-in-time copy: no write is half-applied and no later write
 * leaks into it.
 *
 * <p>
 * Counters are monotonically non-decreasing for the process lifetime.
 * Registering a name twice is a no-op.
 *
 * @since 1.0
 * @see McpMetricNames
 */
@Component
@Slf4j
public class MetricsRegistry {

    private final Clock clock;
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, Double> gauges = new ConcurrentHashMap<>();
    private final ReadWriteLock snapshotLock = new ReentrantReadWriteLock();

    public MetricsRegistry(Clock clock) {
        this.clock = clock;
        McpMetricNames.COUNTERS.forEach(this::registerCounter);
        McpMetricNames.GAUGES.forEach(this::registerGauge);
    }

    public void registerCounter(String name) {
        counters.computeIfAbsent(requireName(name), key -> new AtomicLong());
    }

    public void registerGauge(String name) {
        gauges.putIfAbsent(requireName(name), 0.0);
    }

    public void increment(String name) {
        increment(name, 1);
    }

    public void increment(String name, long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Counter '" + name + "' cannot decrease (delta=" + delta + ")");
        }
        Lock lock = snapshotLock.readLock();
        lock.lock();
        try {
            counters.computeIfAbsent(requireName(name), key -> new AtomicLong()).addAndGet(delta);
        } finally {
            lock.unlock();
        }
    }

    public void setGauge(String name, double value) {
        Lock lock = snapshotLock.readLock();
        lock.lock();
        try {
            gauges.put(requireName(name), value);
        } finally {
            lock.unlock();
        }
    }

    public long getCounter(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0L;
    }

    public Optional<Double> getGauge(String name) {
        return Optional.ofNullable(gauges.get(name));
    }

    public MetricsSnapshot snapshot() {
        Map<String, Long> counterCopy = new HashMap<>();
        Map<String, Double> gaugeCopy;
        Lock lock = snapshotLock.writeLock();
        lock.lock();
        try {
            counters.forEach((name, value) -> counterCopy.put(name, value.get()));
            gaugeCopy = new HashMap<>(gauges);
        } finally {
            lock.unlock();
        }
        return new MetricsSnapshot(clock.instant(), counterCopy, gaugeCopy);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        return name;
    }
}
