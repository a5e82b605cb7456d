package me.golemcore.resilience.telemetry;

import me.golemcore.resilience.domain.model.MetricsSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class McpMetricsSummaryTest {

    @Test
    void from_sumsRejectionsAndComputesRatio() {
        MetricsSnapshot snapshot = new MetricsSnapshot(Instant.EPOCH, Map.of(
                McpMetricNames.CALLS, 6L,
                McpMetricNames.RATE_LIMITED_REJECTIONS, 1L,
                McpMetricNames.BULKHEAD_REJECTIONS, 2L,
                McpMetricNames.CIRCUIT_OPEN_REJECTIONS, 1L), Map.of());

        McpMetricsSummary summary = McpMetricsSummary.from(snapshot);

        assertEquals(4, summary.rejectionsTotal());
        assertEquals(0.4, summary.rejectionRatio(), 1e-9);
    }

    @Test
    void from_returnsZeroRatioWhenNothingAttempted() {
        McpMetricsSummary summary = McpMetricsSummary.from(new MetricsSnapshot(Instant.EPOCH, Map.of(), Map.of()));

        assertEquals(0, summary.rejectionsTotal());
        assertEquals(0.0, summary.rejectionRatio());
    }

    @Test
    void from_allRejectedGivesRatioOne() {
        MetricsSnapshot snapshot = new MetricsSnapshot(Instant.EPOCH,
                Map.of(McpMetricNames.BULKHEAD_REJECTIONS, 3L), Map.of());

        assertEquals(1.0, McpMetricsSummary.from(snapshot).rejectionRatio());
    }
}
