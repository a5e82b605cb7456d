package me.golemcore.resilience.domain.model;

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

import me.golemcore.resilience.telemetry.McpMetricNames;

/**
 * Why a governed call was refused before the operation ran.
 *
 * <p>
 * Each kind maps to exactly one rejection counter and one machine-readable
 * error type surfaced to the agent.
 */
public enum RejectionKind {

    RATE_LIMITED(McpMetricNames.RATE_LIMITED_REJECTIONS, "mcp_rate_limited"),

    BULKHEAD_REJECTED(McpMetricNames.BULKHEAD_REJECTIONS, "mcp_bulkhead_rejected"),

    CIRCUIT_OPEN(McpMetricNames.CIRCUIT_OPEN_REJECTIONS, "mcp_circuit_open");

    private final String counterName;
    private final String errorType;

    RejectionKind(String counterName, String errorType) {
        this.counterName = counterName;
        this.errorType = errorType;
    }

    public String getCounterName() {
        return counterName;
    }

    public String getErrorType() {
        return errorType;
    }
}
