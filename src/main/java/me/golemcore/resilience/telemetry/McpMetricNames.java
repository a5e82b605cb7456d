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

import java.util.List;

/**
 * Stable metric names consumed by the reporting surface and the OTLP exporter.
 */
public final class McpMetricNames {

    /** Governed calls whose operation actually executed. */
    public static final String CALLS = "mcp_calls";
    public static final String RATE_LIMITED_REJECTIONS = "mcp_rate_limited_rejections";
    public static final String BULKHEAD_REJECTIONS = "mcp_bulkhead_rejections";
    public static final String CIRCUIT_OPEN_REJECTIONS = "mcp_circuit_open_rejections";

    public static final String GOVERNED_TARGETS = "mcp_governed_targets";
    public static final String BULKHEAD_IN_FLIGHT = "mcp_bulkhead_in_flight";
    public static final String BULKHEAD_QUEUED = "mcp_bulkhead_queued";
    public static final String CIRCUIT_OPEN_TARGETS = "mcp_circuit_open_targets";

    public static final String EXPORT_QUEUE_FULL_DROPS = "otlp_export_queue_full_drops";
    public static final String EXPORT_RETRIES_EXHAUSTED_DROPS = "otlp_export_retries_exhausted_drops";

    public static final String SUMMARY_REJECTIONS_TOTAL = "mcp_rejections_total";
    public static final String SUMMARY_REJECTION_RATIO = "mcp_rejection_ratio";

    public static final List<String> REJECTION_COUNTERS = List.of(
            RATE_LIMITED_REJECTIONS,
            BULKHEAD_REJECTIONS,
            CIRCUIT_OPEN_REJECTIONS);

    public static final List<String> COUNTERS = List.of(
            CALLS,
            RATE_LIMITED_REJECTIONS,
            BULKHEAD_REJECTIONS,
            CIRCUIT_OPEN_REJECTIONS,
            EXPORT_QUEUE_FULL_DROPS,
            EXPORT_RETRIES_EXHAUSTED_DROPS);

    public static final List<String> GAUGES = List.of(
            GOVERNED_TARGETS,
            BULKHEAD_IN_FLIGHT,
            BULKHEAD_QUEUED,
            CIRCUIT_OPEN_TARGETS);

    private McpMetricNames() {
    }
}
