package me.golemcore.resilience.adapter.outbound.otlp;

import me.golemcore.resilience.domain.model.ExportDropReason;
import me.golemcore.resilience.domain.model.ExportStatus;
import me.golemcore.resilience.domain.model.MetricsSnapshot;
import me.golemcore.resilience.governance.CallGovernor;
import me.golemcore.resilience.infrastructure.config.ResilienceProperties;
import me.golemcore.resilience.telemetry.McpMetricNames;
import me.golemcore.resilience.telemetry.MetricsRegistry;
import me.golemcore.resilience.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class OtlpMetricsExporterTest {

    private ResilienceProperties properties;
    private MetricsRegistry metricsRegistry;
    private CallGovernor callGovernor;
    private OkHttpMockEngine httpEngine;
    private OtlpMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        properties = new ResilienceProperties();
        ResilienceProperties.ObservabilityProperties observability = properties.getObservability();
        observability.setOtlpEnabled(true);
        observability.setOtlpEndpoint("http://collector.local:4318/v1/metrics");
        observability.setOtlpExportIntervalSeconds(3600);
        observability.setOtlpHeaders(Map.of("X-Tenant", "acme"));

        Clock clock = Clock.systemUTC();
        metricsRegistry = new MetricsRegistry(clock);
        callGovernor = mock(CallGovernor.class);
        httpEngine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        exporter = new OtlpMetricsExporter(properties, metricsRegistry, callGovernor, client, new ObjectMapper(),
                clock);
    }

    @AfterEach
    void tearDown() {
        exporter.shutdown();
    }

    @Test
    void init_staysDisabledWhenExportIsOff() {
        properties.getObservability().setOtlpEnabled(false);

        exporter.init();

        assertFalse(exporter.getStatus().isEnabled());
        assertFalse(exporter.sample());
    }

    @Test
    void init_staysDisabledWhenEndpointBlank() {
        properties.getObservability().setOtlpEndpoint("  ");

        exporter.init();

        assertFalse(exporter.getStatus().isEnabled());
    }

    @Test
    void init_staysDisabledWhenEndpointInvalid() {
        properties.getObservability().setOtlpEndpoint("not a url");

        exporter.init();

        assertFalse(exporter.getStatus().isEnabled());
    }

    @Test
    void sample_publishesGaugesAndShipsSnapshot() throws Exception {
        httpEngine.enqueueStatus(200);
        metricsRegistry.increment(McpMetricNames.CALLS, 7);
        exporter.init();

        assertTrue(exporter.sample());

        verify(callGovernor).publishGauges();
        awaitSent(1);
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("acme", request.header("X-Tenant"));
        assertTrue(request.body().contains("\"golemcore_mcp_calls\""));
        assertTrue(request.body().contains("\"asInt\":\"7\""));

        ExportStatus status = exporter.getStatus();
        assertTrue(status.isEnabled());
        assertEquals("http://collector.local:4318/v1/metrics", status.getEndpoint());
        assertEquals(256, status.getQueueCapacity());
        assertEquals(0, status.getQueueFullDrops());
    }

    @Test
    void init_clampsQueueCapacity() {
        properties.getObservability().setOtlpQueueCapacity(1);

        exporter.init();

        assertEquals(8, exporter.getStatus().getQueueCapacity());
    }

    @Test
    void onDrop_countsEachReason() {
        MetricsSnapshot snapshot = metricsRegistry.snapshot();

        exporter.onDrop(ExportDropReason.QUEUE_FULL, snapshot, 0);
        exporter.onDrop(ExportDropReason.RETRIES_EXHAUSTED, snapshot, 4);
        exporter.onDrop(ExportDropReason.RETRIES_EXHAUSTED, snapshot, 4);

        assertEquals(1, metricsRegistry.getCounter(McpMetricNames.EXPORT_QUEUE_FULL_DROPS));
        assertEquals(2, metricsRegistry.getCounter(McpMetricNames.EXPORT_RETRIES_EXHAUSTED_DROPS));
    }

    @Test
    void shutdown_disablesExport() {
        exporter.init();

        exporter.shutdown();

        assertFalse(exporter.getStatus().isEnabled());
        assertFalse(exporter.sample());
    }

    private void awaitSent(long expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (exporter.getStatus().getSent() < expected) {
            if (System.nanoTime() > deadline) {
                fail("snapshot was never sent");
            }
            Thread.sleep(10);
        }
    }
}
