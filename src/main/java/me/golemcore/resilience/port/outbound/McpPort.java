package me.golemcore.resilience.port.outbound;

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

import me.golemcore.resilience.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for invoking tools on a connected MCP server. The transport and wire
 * protocol live behind this port; governance treats each call as opaque.
 */
public interface McpPort {

    /**
     * Invoke a tool on the named server.
     */
    CompletableFuture<ToolResult> callTool(String serverName, String toolName, Map<String, Object> arguments);

    /**
     * Whether the named server is connected and able to take calls.
     */
    boolean isRunning(String serverName);
}
