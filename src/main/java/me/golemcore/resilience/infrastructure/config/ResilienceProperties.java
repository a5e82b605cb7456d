package me.golemcore.resilience.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code resilience.*} prefix:
 * <ul>
 * <li>{@link McpProperties} - call governance for MCP tool servers</li>
 * <li>{@link ObservabilityProperties} - OTLP metrics export</li>
 * <li>{@link HttpProperties} - shared HTTP client settings</li>
 * </ul>
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "resilience")
@Data
public class ResilienceProperties {

    private McpProperties mcp = new McpProperties();
    private ObservabilityProperties observability = new ObservabilityProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== MCP GOVERNANCE ====================

    @Data
    public static class McpProperties {
        /** When false, governed calls run without admission control. */
        private boolean enabled = true;

        /** Max time the tool adapter waits for a remote call to complete. */
        private long callTimeoutMs = 60000;

        /**
         * Upper bound on threads running governed calls. Each call queued in a bulkhead
         * holds one; calls beyond the bound fail fast as executor unavailable.
         */
        private int maxCallThreads = 64;

        private GovernanceDefaults defaults = new GovernanceDefaults();

        /**
         * Per-target overrides keyed by target name (MCP server name). Unset keys fall
         * back to {@link #defaults}.
         */
        private Map<String, GovernanceOverrides> targets = new LinkedHashMap<>();
    }

    @Data
    public static class GovernanceDefaults {
        private int maxConcurrentRequests = 4;
        private long queueWaitMs = 200;
        private int rateLimitPerMinute = 120;
        private int failureThreshold = 5;
        private long cooldownMs = 30000;
    }

    @Data
    public static class GovernanceOverrides {
        private Integer maxConcurrentRequests;
        private Long queueWaitMs;
        private Integer rateLimitPerMinute;
        private Integer failureThreshold;
        private Long cooldownMs;
    }

    // ==================== OBSERVABILITY (OTLP) ====================

    @Data
    public static class ObservabilityProperties {
        private boolean otlpEnabled = false;
        private String otlpEndpoint = "";
        private int otlpQueueCapacity = 256;
        private int otlpRetryMaxAttempts = 3;
        private long otlpRetryBaseMs = 500;
        private long otlpRetryMaxMs = 8000;
        private int otlpExportIntervalSeconds = 15;
        private Map<String, String> otlpHeaders = new HashMap<>();

        /** HTTP call timeout for a single export attempt. */
        private long otlpTimeoutMs = 10000;

        private String serviceName = "golemcore";
        private String metricPrefix = "golemcore_";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
