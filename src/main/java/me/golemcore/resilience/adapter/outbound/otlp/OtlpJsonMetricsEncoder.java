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

import me.golemcore.resilience.domain.model.MetricsSnapshot;
import me.golemcore.resilience.port.outbound.MetricsEncoder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Map;

/**
 * Renders a {@link MetricsSnapshot} as an OTLP/HTTP JSON
 * {@code ExportMetricsServiceRequest}.
 *
 * <p>
 * Counters become cumulative monotonic {@code sum} metrics starting at
 * {@code startTime}; gauges become {@code gauge} metrics. Every name is
 * prefixed, values are clamped at zero and 64-bit integers are written as
 * strings, as the OTLP JSON mapping requires.
 */
public class OtlpJsonMetricsEncoder implements MetricsEncoder {

    static final String SCOPE_NAME = "golemcore.resilience";
    static final String SCOPE_VERSION = "1";
    static final int AGGREGATION_TEMPORALITY_CUMULATIVE = 2;

    private final ObjectMapper objectMapper;
    private final String serviceName;
    private final String metricPrefix;
    private final Instant startTime;

    public OtlpJsonMetricsEncoder(ObjectMapper objectMapper, String serviceName, String metricPrefix,
            Instant startTime) {
        this.objectMapper = objectMapper;
        this.serviceName = serviceName;
        this.metricPrefix = metricPrefix != null ? metricPrefix : "";
        this.startTime = startTime;
    }

    @Override
    public byte[] encode(MetricsSnapshot snapshot) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode resourceMetrics = root.putArray("resourceMetrics").addObject();

        ArrayNode attributes = resourceMetrics.putObject("resource").putArray("attributes");
        ObjectNode serviceAttribute = attributes.addObject();
        serviceAttribute.put("key", "service.name");
        serviceAttribute.putObject("value").put("stringValue", serviceName);

        ObjectNode scopeMetrics = resourceMetrics.putArray("scopeMetrics").addObject();
        ObjectNode scope = scopeMetrics.putObject("scope");
        scope.put("name", SCOPE_NAME);
        scope.put("version", SCOPE_VERSION);

        ArrayNode metrics = scopeMetrics.putArray("metrics");
        String timeNanos = toUnixNanos(snapshot.timestamp());
        String startNanos = toUnixNanos(startTime);

        for (Map.Entry<String, Long> counter : snapshot.counters().entrySet()) {
            ObjectNode metric = metrics.addObject();
            metric.put("name", metricPrefix + counter.getKey());
            ObjectNode sum = metric.putObject("sum");
            ObjectNode point = sum.putArray("dataPoints").addObject();
            point.put("startTimeUnixNano", startNanos);
            point.put("timeUnixNano", timeNanos);
            point.put("asInt", Long.toString(Math.max(0L, counter.getValue())));
            sum.put("aggregationTemporality", AGGREGATION_TEMPORALITY_CUMULATIVE);
            sum.put("isMonotonic", true);
        }

        for (Map.Entry<String, Double> gauge : snapshot.gauges().entrySet()) {
            ObjectNode metric = metrics.addObject();
            metric.put("name", metricPrefix + gauge.getKey());
            ObjectNode point = metric.putObject("gauge").putArray("dataPoints").addObject();
            point.put("timeUnixNano", timeNanos);
            point.put("asDouble", clampGauge(gauge.getValue()));
        }

        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode metrics snapshot", e);
        }
    }

    private static double clampGauge(Double value) {
        if (value == null || value.isNaN() || value < 0) {
            return 0.0;
        }
        return value.isInfinite() ? Double.MAX_VALUE : value;
    }

    static String toUnixNanos(Instant instant) {
        return Long.toString(instant.getEpochSecond() * 1_000_000_000L + instant.getNano());
    }
}
