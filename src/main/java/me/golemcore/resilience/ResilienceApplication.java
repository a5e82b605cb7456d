package me.golemcore.resilience;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Resilience.
 *
 * <p>
 * Protects the agent runtime from misbehaving or overloaded MCP tool servers
 * and ships runtime counters to an OTLP collector.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Call Governance</b> - per-target rate limiting, circuit breaking and
 * bulkhead isolation around every MCP tool call</li>
 * <li><b>Metrics Registry</b> - process-wide counters and gauges with
 * consistent point-in-time snapshots</li>
 * <li><b>OTLP Export</b> - bounded export queue with retry and exponential
 * backoff</li>
 * <li><b>Reporting API</b> - {@code /api/metrics} endpoints for dashboards</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Tool call    → McpToolAdapter → CallGovernor → [RateLimiter → CircuitBreaker → Bulkhead] → McpPort
 * Telemetry    → MetricsRegistry → OtlpMetricsExporter → ExportQueue → OtlpHttpMetricsSender
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code resilience.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ResilienceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResilienceApplication.class, args);
    }

}
