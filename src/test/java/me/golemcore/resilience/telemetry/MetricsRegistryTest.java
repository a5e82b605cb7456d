package me.golemcore.resilience.telemetry;

import me.golemcore.resilience.domain.model.MetricsSnapshot;
import me.golemcore.resilience.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MetricsRegistryTest {

    private MutableClock clock;
    private MetricsRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new MetricsRegistry(clock);
    }

    @Test
    void constructor_registersKnownMetricsAtZero() {
        MetricsSnapshot snapshot = registry.snapshot();

        for (String counter : McpMetricNames.COUNTERS) {
            assertEquals(0L, snapshot.counters().get(counter), counter);
        }
        for (String gauge : McpMetricNames.GAUGES) {
            assertEquals(0.0, snapshot.gauges().get(gauge), gauge);
        }
        assertEquals(clock.instant(), snapshot.timestamp());
    }

    @Test
    void registerCounter_isIdempotent() {
        registry.increment("custom_total", 5);
        registry.registerCounter("custom_total");

        assertEquals(5, registry.getCounter("custom_total"));
    }

    @Test
    void increment_rejectsNegativeDelta() {
        assertThrows(IllegalArgumentException.class, () -> registry.increment(McpMetricNames.CALLS, -1));
        assertEquals(0, registry.getCounter(McpMetricNames.CALLS));
    }

    @Test
    void increment_rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> registry.increment(" "));
    }

    @Test
    void setGauge_overwritesValue() {
        registry.setGauge(McpMetricNames.BULKHEAD_QUEUED, 3);
        registry.setGauge(McpMetricNames.BULKHEAD_QUEUED, 1);

        assertEquals(1.0, registry.snapshot().gauge(McpMetricNames.BULKHEAD_QUEUED));
        assertTrue(registry.getGauge("unknown").isEmpty());
    }

    @Test
    void snapshot_isImmutableCopy() {
        registry.increment(McpMetricNames.CALLS);
        MetricsSnapshot snapshot = registry.snapshot();

        registry.increment(McpMetricNames.CALLS);

        assertEquals(1, snapshot.counter(McpMetricNames.CALLS));
        assertEquals(2, registry.getCounter(McpMetricNames.CALLS));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.counters().put("x", 1L));
    }

    @Test
    void snapshot_countersNeverGoBackwardsUnderConcurrentWrites() throws Exception {
        int writers = 8;
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(writers);
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                futures.add(executor.submit(() -> {
                    started.countDown();
                    while (running.get()) {
                        registry.increment(McpMetricNames.CALLS);
                        registry.increment(McpMetricNames.RATE_LIMITED_REJECTIONS);
                    }
                }));
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));

            long previous = -1;
            for (int i = 0; i < 200; i++) {
                MetricsSnapshot snapshot = registry.snapshot();
                long calls = snapshot.counter(McpMetricNames.CALLS);
                assertTrue(calls >= previous, "counter went backwards");
                previous = calls;
            }

            running.set(false);
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            running.set(false);
            executor.shutdownNow();
        }

        MetricsSnapshot last = registry.snapshot();
        assertEquals(last.counter(McpMetricNames.CALLS), last.counter(McpMetricNames.RATE_LIMITED_REJECTIONS));
    }
}
