package me.golemcore.resilience.adapter.outbound.otlp;

import me.golemcore.resilience.domain.model.ExportDropReason;
import me.golemcore.resilience.domain.model.MetricsSnapshot;
import me.golemcore.resilience.port.outbound.MetricsSenderPort;
import me.golemcore.resilience.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExportQueueTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private MetricsSenderPort sender;
    private List<String> drops;
    private ExportQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        sender = mock(MetricsSenderPort.class);
        drops = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.close();
        }
    }

    private ExportQueue newQueue(int capacity) {
        queue = new ExportQueue(capacity, 3, 500, 8000,
                snapshot -> snapshot.timestamp().toString().getBytes(StandardCharsets.UTF_8),
                sender,
                (reason, snapshot, attempts) -> drops.add(reason.getCode() + ":" + attempts),
                clock);
        return queue;
    }

    private MetricsSnapshot snapshotAt(Instant timestamp) {
        return new MetricsSnapshot(timestamp, Map.of("mcp_calls", 1L), Map.of());
    }

    @Test
    void tryEnqueue_rejectsWhenFullAndKeepsArrivalOrder() {
        newQueue(2);
        MetricsSnapshot first = snapshotAt(T0);
        MetricsSnapshot second = snapshotAt(T0.plusSeconds(1));

        assertTrue(queue.tryEnqueue(first));
        assertTrue(queue.tryEnqueue(second));
        assertFalse(queue.tryEnqueue(snapshotAt(T0.plusSeconds(2))));

        List<ExportItem> pending = queue.pendingItems();
        assertEquals(2, pending.size());
        assertSame(first, pending.get(0).getSnapshot());
        assertSame(second, pending.get(1).getSnapshot());
        assertEquals(1, queue.getQueueFullDrops());
        assertEquals(List.of("queue_full:0"), drops);
    }

    @Test
    void processNext_discardsItemOnSuccess() throws Exception {
        newQueue(4);
        when(sender.send(any())).thenReturn(true);
        queue.tryEnqueue(snapshotAt(T0));

        assertTrue(queue.processNext(0));

        assertEquals(0, queue.size());
        assertEquals(1, queue.getSentCount());
        assertTrue(drops.isEmpty());
    }

    @Test
    void processNext_backsOffThenDropsAfterRetriesExhausted() throws Exception {
        newQueue(4);
        when(sender.send(any())).thenReturn(false);
        queue.tryEnqueue(snapshotAt(T0));

        long[] expectedDelays = {500, 1000, 2000};
        for (int attempt = 1; attempt <= expectedDelays.length; attempt++) {
            assertTrue(queue.processNext(0));
            ExportItem retried = queue.pendingItems().get(0);
            assertEquals(attempt, retried.getAttemptCount());
            assertEquals(clock.instant().plusMillis(expectedDelays[attempt - 1]), retried.getNotBeforeTime());

            assertFalse(queue.processNext(0), "item must wait for its backoff");
            clock.advance(Duration.ofMillis(expectedDelays[attempt - 1]));
        }

        assertTrue(queue.processNext(0));

        assertEquals(0, queue.size());
        assertEquals(1, queue.getRetriesExhaustedDrops());
        assertEquals(List.of("retries_exhausted:4"), drops);
        verify(sender, times(4)).send(any());
    }

    @Test
    void processNext_treatsSenderExceptionAsFailure() throws Exception {
        newQueue(4);
        when(sender.send(any())).thenThrow(new IllegalStateException("encoder exploded"));
        queue.tryEnqueue(snapshotAt(T0));

        assertTrue(queue.processNext(0));

        assertEquals(1, queue.size());
        assertEquals(1, queue.pendingItems().get(0).getAttemptCount());
    }

    @Test
    void processNext_treatsSenderErrorAsFailure() throws Exception {
        newQueue(4);
        when(sender.send(any())).thenThrow(new NoClassDefFoundError("okhttp3/internal/Util"));
        queue.tryEnqueue(snapshotAt(T0));

        assertTrue(queue.processNext(0));

        assertEquals(1, queue.size());
        assertEquals(1, queue.pendingItems().get(0).getAttemptCount());
    }

    @Test
    void start_workerSurvivesSenderError() {
        queue = new ExportQueue(4, 3, 50, 100, snapshot -> new byte[0], sender,
                (reason, snapshot, attempts) -> drops.add(reason.getCode()), Clock.systemUTC());
        when(sender.send(any()))
                .thenThrow(new NoClassDefFoundError("okhttp3/internal/Util"))
                .thenReturn(true);

        queue.start();
        queue.tryEnqueue(snapshotAt(Instant.now()));
        queue.tryEnqueue(snapshotAt(Instant.now()));

        verify(sender, timeout(5000).times(3)).send(any());
        long deadline = System.currentTimeMillis() + 5000;
        while (queue.getSentCount() < 2 && System.currentTimeMillis() < deadline) {
            Thread.onSpinWait();
        }
        assertEquals(2, queue.getSentCount());
        assertEquals(0, queue.size());
        assertTrue(drops.isEmpty());
    }

    @Test
    void processNext_dueNewItemGoesBeforeBackedOffRetry() throws Exception {
        newQueue(4);
        when(sender.send(any())).thenReturn(false);
        MetricsSnapshot failing = snapshotAt(T0);
        queue.tryEnqueue(failing);
        queue.processNext(0);

        MetricsSnapshot fresh = snapshotAt(T0.plusSeconds(1));
        queue.tryEnqueue(fresh);

        List<ExportItem> pending = queue.pendingItems();
        assertSame(fresh, pending.get(0).getSnapshot());
        assertSame(failing, pending.get(1).getSnapshot());
    }

    @Test
    void processNext_returnsFalseWhenEmpty() throws Exception {
        newQueue(2);

        assertFalse(queue.processNext(0));
        verify(sender, never()).send(any());
    }

    @Test
    void computeDelayMs_doublesAndCaps() {
        newQueue(2);

        assertEquals(500, queue.computeDelayMs(1));
        assertEquals(1000, queue.computeDelayMs(2));
        assertEquals(2000, queue.computeDelayMs(3));
        assertEquals(4000, queue.computeDelayMs(4));
        assertEquals(8000, queue.computeDelayMs(5));
        assertEquals(8000, queue.computeDelayMs(64));
    }

    @Test
    void start_workerDrainsQueue() {
        queue = new ExportQueue(4, 3, 50, 100, snapshot -> new byte[0], sender,
                (reason, snapshot, attempts) -> drops.add(reason.getCode()), Clock.systemUTC());
        when(sender.send(any())).thenReturn(true);

        queue.start();
        queue.tryEnqueue(snapshotAt(Instant.now()));

        verify(sender, timeout(5000)).send(any());
    }

    @Test
    void close_stopsAcceptingSnapshots() {
        newQueue(2);
        queue.start();

        queue.close();

        assertFalse(queue.tryEnqueue(snapshotAt(T0)));
    }

    @Test
    void constructor_rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ExportQueue(0, 3, 500, 8000,
                snapshot -> new byte[0], sender, (r, s, a) -> {
                }, clock));
        assertThrows(IllegalArgumentException.class, () -> new ExportQueue(2, 0, 500, 8000,
                snapshot -> new byte[0], sender, (r, s, a) -> {
                }, clock));
    }

    @Test
    void dropReasonCodesAreStable() {
        assertEquals("queue_full", ExportDropReason.QUEUE_FULL.getCode());
        assertEquals("retries_exhausted", ExportDropReason.RETRIES_EXHAUSTED.getCode());
    }
}
