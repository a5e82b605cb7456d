package me.golemcore.resilience.adapter.inbound.web.controller;

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

import me.golemcore.resilience.adapter.inbound.web.dto.MetricsResponse;
import me.golemcore.resilience.adapter.inbound.web.dto.TargetStateDto;
import me.golemcore.resilience.adapter.outbound.otlp.OtlpMetricsExporter;
import me.golemcore.resilience.domain.model.CircuitBreakerState;
import me.golemcore.resilience.domain.model.ExportStatus;
import me.golemcore.resilience.domain.model.GovernancePolicy;
import me.golemcore.resilience.domain.model.MetricsSnapshot;
import me.golemcore.resilience.domain.model.TargetGovernanceState;
import me.golemcore.resilience.governance.CallGovernor;
import me.golemcore.resilience.telemetry.McpMetricsSummary;
import me.golemcore.resilience.telemetry.MetricsRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runtime metrics and governance state endpoints.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final MetricsRegistry metricsRegistry;
    private final CallGovernor callGovernor;
    private final OtlpMetricsExporter metricsExporter;

    @GetMapping
    public Mono<ResponseEntity<MetricsResponse>> getMetrics() {
        MetricsSnapshot snapshot = takeSnapshot();
        return Mono.just(ResponseEntity.ok(toResponse(snapshot).build()));
    }

    @GetMapping("/summary")
    public Mono<ResponseEntity<MetricsResponse>> getSummary() {
        MetricsSnapshot snapshot = takeSnapshot();
        McpMetricsSummary summary = McpMetricsSummary.from(snapshot);
        MetricsResponse response = toResponse(snapshot)
                .summary(MetricsResponse.Summary.builder()
                        .mcpRejectionsTotal(summary.rejectionsTotal())
                        .mcpRejectionRatio(summary.rejectionRatio())
                        .build())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/targets")
    public Mono<ResponseEntity<List<TargetStateDto>>> getTargets() {
        List<TargetStateDto> targets = callGovernor.describeTargets().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(targets));
    }

    @GetMapping("/export")
    public Mono<ResponseEntity<ExportStatus>> getExportStatus() {
        return Mono.just(ResponseEntity.ok(metricsExporter.getStatus()));
    }

    private MetricsSnapshot takeSnapshot() {
        callGovernor.publishGauges();
        return metricsRegistry.snapshot();
    }

    private MetricsResponse.MetricsResponseBuilder toResponse(MetricsSnapshot snapshot) {
        return MetricsResponse.builder()
                .timestamp(snapshot.timestamp())
                .counters(snapshot.counters())
                .gauges(snapshot.gauges());
    }

    private TargetStateDto toDto(TargetGovernanceState state) {
        GovernancePolicy policy = state.getPolicy();
        CircuitBreakerState breaker = state.getBreaker();
        TargetStateDto.TargetStateDtoBuilder builder = TargetStateDto.builder()
                .target(state.getTarget())
                .maxConcurrentRequests(policy.getMaxConcurrentRequests())
                .queueWaitMs(policy.getQueueWait().toMillis())
                .rateLimitPerMinute(policy.getRateLimitPerMinute())
                .failureThreshold(policy.getFailureThreshold())
                .cooldownMs(policy.getCooldown().toMillis())
                .inFlight(state.getBulkhead().getInFlight())
                .queued(state.getBulkhead().getQueued())
                .breakerStatus(breaker.getStatus().name())
                .consecutiveFailures(breaker.getConsecutiveFailures())
                .openedAt(breaker.getOpenedAt())
                .probeInFlight(breaker.isProbeInFlight());
        if (state.getRateWindow() != null) {
            builder.rateWindowStartMinute(state.getRateWindow().getWindowStartMinute())
                    .rateWindowCount(state.getRateWindow().getCount());
        }
        return builder.build();
    }
}
