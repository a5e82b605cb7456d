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

/**
 * Derived rejection figures for the reporting surface.
 *
 * @param rejectionsTotal
 *            sum of the three rejection counters
 * @param rejectionRatio
 *            {@code rejectionsTotal / (mcp_calls + rejectionsTotal)}, or 0 when
 *            nothing was attempted
 */
public record McpMetricsSummary(long rejectionsTotal, double rejectionRatio) {

    public static McpMetricsSummary from(MetricsSnapshot snapshot) {
        long rejections = 0;
        for (String name : McpMetricNames.REJECTION_COUNTERS) {
            rejections += snapshot.counter(name);
        }
        long attempted = snapshot.counter(McpMetricNames.CALLS) + rejections;
        double ratio = attempted > 0 ? (double) rejections / (double) attempted : 0.0;
        return new McpMetricsSummary(rejections, ratio);
    }
}
