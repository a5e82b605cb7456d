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
import me.golemcore.resilience.domain.model.ExportStatus;
import me.golemcore.resilience.domain.model.MetricsSnapshot;
import me.golemcore.resilience.governance.CallGovernor;
import me.golemcore.resilience.infrastructure.config.ResilienceProperties;
import me.golemcore.resilience.telemetry.McpMetricNames;
import me.golemcore.resilience.telemetry.MetricsRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically samples the {@link MetricsRegistry} and ships snapshots to an
 * OTLP/HTTP collector.
 *
 * <p>
 * A single-thread scheduler refreshes the governance gauges, takes a snapshot
 * and offers it to the {@link ExportQueue}; the queue's own worker thread does
 * the sending. The sampler never blocks on the network: a full queue drops the
 * snapshot and counts it as {@code otlp_export_queue_full_drops}.
 *
 * <p>
 * Configuration ({@code resilience.observability.*}):
 * <ul>
 * <li>{@code otlp-enabled} - master switch</li>
 * <li>{@code otlp-endpoint} - collector metrics URL; blank keeps export
 * off</li>
 * <li>{@code otlp-queue-capacity}, {@code otlp-retry-*} - queue and backoff
 * bounds</li>
 * <li>{@code otlp-export-interval-seconds} - sampling period</li>
 * <li>{@code otlp-headers} - attached to every request</li>
 * </ul>
 *
 * @see ExportQueue
 * @see OtlpJsonMetricsEncoder
 * @see OtlpHttpMetricsSender
 */
@Component
@Slf4j
public class OtlpMetricsExporter {

    private final ResilienceProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final CallGovernor callGovernor;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile ExportQueue exportQueue;
    private volatile String endpoint;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sampleTask;

    public OtlpMetricsExporter(ResilienceProperties properties, MetricsRegistry metricsRegistry,
            CallGovernor callGovernor, OkHttpClient httpClient, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        this.callGovernor = callGovernor;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        ResilienceProperties.ObservabilityProperties observability = properties.getObservability();
        if (!observability.isOtlpEnabled()) {
            log.info("[OtlpExport] Disabled");
            return;
        }
        OtlpExportSettings settings = OtlpExportSettings.from(observability);
        if (settings.getEndpoint().isEmpty()) {
            log.warn("[OtlpExport] Enabled but otlp-endpoint is blank, export stays off");
            return;
        }
        if (HttpUrl.parse(settings.getEndpoint()) == null) {
            log.warn("[OtlpExport] Invalid otlp-endpoint '{}', export stays off", settings.getEndpoint());
            return;
        }

        ExportQueue queue = createQueue(settings);
        queue.start();
        this.exportQueue = queue;
        this.endpoint = settings.getEndpoint();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "otlp-metrics-sampler");
            t.setDaemon(true);
            return t;
        });
        int interval = settings.getExportIntervalSeconds();
        sampleTask = scheduler.scheduleAtFixedRate(this::sampleSafely, interval, interval, TimeUnit.SECONDS);

        log.info("[OtlpExport] Started: endpoint={}, interval={}s, queueCapacity={}, maxAttempts={}",
                settings.getEndpoint(), interval, settings.getQueueCapacity(), settings.getRetryMaxAttempts());
    }

    ExportQueue createQueue(OtlpExportSettings settings) {
        OtlpJsonMetricsEncoder encoder = new OtlpJsonMetricsEncoder(objectMapper, settings.getServiceName(),
                settings.getMetricPrefix(), clock.instant());
        OtlpHttpMetricsSender sender = new OtlpHttpMetricsSender(httpClient, settings.getEndpoint(),
                settings.getHeaders(), settings.getTimeoutMs());
        return new ExportQueue(settings.getQueueCapacity(), settings.getRetryMaxAttempts(),
                settings.getRetryBaseMs(), settings.getRetryMaxMs(), encoder, sender, this::onDrop, clock);
    }

    /**
     * Take one snapshot and offer it to the export queue.
     *
     * @return true if the snapshot was queued
     */
    public boolean sample() {
        ExportQueue queue = exportQueue;
        if (queue == null) {
            return false;
        }
        callGovernor.publishGauges();
        MetricsSnapshot snapshot = metricsRegistry.snapshot();
        return queue.tryEnqueue(snapshot);
    }

    private void sampleSafely() {
        try {
            sample();
        } catch (RuntimeException e) {
            log.error("[OtlpExport] Sampling failed", e);
        }
    }

    void onDrop(ExportDropReason reason, MetricsSnapshot snapshot, int attempts) {
        if (reason == ExportDropReason.QUEUE_FULL) {
            metricsRegistry.increment(McpMetricNames.EXPORT_QUEUE_FULL_DROPS);
            log.warn("[OtlpExport] Queue full, dropped snapshot taken at {}", snapshot.timestamp());
        } else {
            metricsRegistry.increment(McpMetricNames.EXPORT_RETRIES_EXHAUSTED_DROPS);
            log.warn("[OtlpExport] Dropped snapshot taken at {} after {} failed attempts",
                    snapshot.timestamp(), attempts);
        }
    }

    public ExportStatus getStatus() {
        ExportQueue queue = exportQueue;
        if (queue == null) {
            return ExportStatus.disabled();
        }
        return ExportStatus.builder()
                .enabled(true)
                .endpoint(endpoint)
                .queueDepth(queue.size())
                .queueCapacity(queue.getCapacity())
                .sent(queue.getSentCount())
                .queueFullDrops(queue.getQueueFullDrops())
                .retriesExhaustedDrops(queue.getRetriesExhaustedDrops())
                .build();
    }

    @PreDestroy
    public void shutdown() {
        if (sampleTask != null) {
            sampleTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        ExportQueue queue = exportQueue;
        if (queue != null) {
            queue.close();
            exportQueue = null;
            log.info("[OtlpExport] Stopped");
        }
    }
}
