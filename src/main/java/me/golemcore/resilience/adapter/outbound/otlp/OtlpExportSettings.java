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

import me.golemcore.resilience.infrastructure.config.ResilienceProperties;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Export settings after clamping configured values to supported bounds.
 */
@Value
@Slf4j
class OtlpExportSettings {

    String endpoint;
    Map<String, String> headers;
    int queueCapacity;
    int retryMaxAttempts;
    long retryBaseMs;
    long retryMaxMs;
    int exportIntervalSeconds;
    long timeoutMs;
    String serviceName;
    String metricPrefix;

    static OtlpExportSettings from(ResilienceProperties.ObservabilityProperties props) {
        return new OtlpExportSettings(
                props.getOtlpEndpoint() != null ? props.getOtlpEndpoint().trim() : "",
                props.getOtlpHeaders() != null ? Map.copyOf(props.getOtlpHeaders()) : Map.of(),
                (int) clamp("otlp-queue-capacity", props.getOtlpQueueCapacity(), 8, 100_000),
                (int) clamp("otlp-retry-max-attempts", props.getOtlpRetryMaxAttempts(), 1, 10),
                clamp("otlp-retry-base-ms", props.getOtlpRetryBaseMs(), 50, 60_000),
                clamp("otlp-retry-max-ms", props.getOtlpRetryMaxMs(), 100, 600_000),
                (int) clamp("otlp-export-interval-seconds", props.getOtlpExportIntervalSeconds(), 1, 3600),
                clamp("otlp-timeout-ms", props.getOtlpTimeoutMs(), 100, 600_000),
                props.getServiceName() == null || props.getServiceName().isBlank()
                        ? "golemcore"
                        : props.getServiceName().trim(),
                props.getMetricPrefix() != null ? props.getMetricPrefix() : "");
    }

    private static long clamp(String key, long value, long min, long max) {
        long clamped = Math.max(min, Math.min(max, value));
        if (clamped != value) {
            log.warn("[OtlpExport] {}={} out of range [{}..{}], using {}", key, value, min, max, clamped);
        }
        return clamped;
    }
}
