package me.golemcore.resilience.adapter.outbound.mcp;

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

import me.golemcore.resilience.domain.component.ToolComponent;
import me.golemcore.resilience.domain.model.ToolDefinition;
import me.golemcore.resilience.governance.CallGovernor;
import me.golemcore.resilience.infrastructure.config.ResilienceProperties;
import me.golemcore.resilience.port.outbound.McpPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates governed {@link McpToolAdapter} instances for the tools an MCP server
 * advertises.
 *
 * <p>
 * Owns the executor that runs governed calls. Calls may block while queued in a
 * bulkhead, so they run on dedicated daemon threads rather than the common
 * pool, capped at {@code resilience.mcp.max-call-threads}.
 *
 * @see McpToolAdapter
 */
@Component
@Slf4j
public class McpToolAdapterFactory {

    private final CallGovernor callGovernor;
    private final ResilienceProperties properties;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ThreadPoolExecutor executor;

    public McpToolAdapterFactory(CallGovernor callGovernor, ResilienceProperties properties) {
        this.callGovernor = callGovernor;
        this.properties = properties;
        int maxThreads = Math.max(1, properties.getMcp().getMaxCallThreads());
        this.executor = new ThreadPoolExecutor(0, maxThreads, 60, TimeUnit.SECONDS, new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "mcp-call-" + threadCounter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    public ToolComponent createToolAdapter(String serverName, ToolDefinition definition, McpPort mcpPort) {
        return new McpToolAdapter(serverName, definition, mcpPort, callGovernor,
                properties.getMcp().getCallTimeoutMs(), executor);
    }

    public List<ToolComponent> createToolAdapters(String serverName, List<ToolDefinition> definitions,
            McpPort mcpPort) {
        List<ToolComponent> adapters = definitions.stream()
                .map(definition -> createToolAdapter(serverName, definition, mcpPort))
                .toList();
        log.info("[McpTools] Registered {} governed tools for server '{}'", adapters.size(), serverName);
        return adapters;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
