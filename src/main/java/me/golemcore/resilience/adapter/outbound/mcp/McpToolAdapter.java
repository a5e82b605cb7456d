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
import me.golemcore.resilience.domain.model.CallOutcome;
import me.golemcore.resilience.domain.model.GuardResult;
import me.golemcore.resilience.domain.model.RejectionKind;
import me.golemcore.resilience.domain.model.ToolDefinition;
import me.golemcore.resilience.domain.model.ToolFailureKind;
import me.golemcore.resilience.domain.model.ToolResult;
import me.golemcore.resilience.governance.CallGovernor;
import me.golemcore.resilience.port.outbound.McpPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps a single MCP tool as a governed ToolComponent.
 *
 * <p>
 * Every call goes through {@link CallGovernor#guard} with the MCP server name
 * as the target, so one misbehaving server cannot exhaust the runtime. Created
 * dynamically by {@link McpToolAdapterFactory}, not a Spring bean.
 *
 * <p>
 * Outcome mapping:
 * <ul>
 * <li>Remote success → success</li>
 * <li>Remote failure classified as a policy or confirmation denial → neutral
 * denial (not a breaker failure)</li>
 * <li>Any other remote failure, exception or timeout → breaker failure,
 * {@code errorType=mcp_error}</li>
 * <li>Governance rejection → non-fatal failure with
 * {@link ToolFailureKind#GOVERNANCE_REJECTED} and the rejection's error
 * type</li>
 * </ul>
 * The returned future always completes normally so a rejection never
 * terminates the session.
 *
 * @see McpToolAdapterFactory
 * @see CallGovernor
 */
@Slf4j
public class McpToolAdapter implements ToolComponent {

    static final int MAX_TOOL_NAME_LENGTH = 64;
    static final String ERROR_TYPE_GENERIC = "mcp_error";
    static final String ERROR_TYPE_CANCELLED = "mcp_cancelled";
    private static final String ERROR_PREFIX = "MCP tool error: ";

    private final String serverName;
    private final String remoteToolName;
    private final ToolDefinition definition;
    private final McpPort mcpPort;
    private final CallGovernor callGovernor;
    private final long callTimeoutMs;
    private final ExecutorService executor;

    public McpToolAdapter(String serverName, ToolDefinition remoteDefinition, McpPort mcpPort,
            CallGovernor callGovernor, long callTimeoutMs, ExecutorService executor) {
        this.serverName = serverName;
        this.remoteToolName = remoteDefinition.getName();
        this.definition = ToolDefinition.builder()
                .name(qualifiedName(serverName, remoteDefinition.getName()))
                .description("[MCP:" + serverName + "] " + remoteDefinition.getDescription())
                .inputSchema(remoteDefinition.getInputSchema())
                .build();
        this.mcpPort = mcpPort;
        this.callGovernor = callGovernor;
        this.callTimeoutMs = callTimeoutMs;
        this.executor = executor;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    /**
     * Runs the governed call on the adapter's executor. Cancelling the returned
     * future interrupts the call, so a caller still queued in the bulkhead leaves
     * the queue and never reaches the server.
     */
    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> runGoverned(parameters, result));
        } catch (RejectedExecutionException e) {
            log.warn("[MCP:{}] Tool '{}' rejected: executor saturated", serverName, remoteToolName);
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    ERROR_TYPE_GENERIC, ERROR_PREFIX + "executor unavailable"));
        }
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    private void runGoverned(Map<String, Object> parameters, CompletableFuture<ToolResult> result) {
        try {
            result.complete(toToolResult(callGovernor.guard(serverName, () -> invoke(parameters))));
        } catch (RuntimeException e) {
            log.warn("[MCP:{}] Tool '{}' crashed: {}", serverName, remoteToolName, e.getMessage());
            result.complete(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, ERROR_TYPE_GENERIC,
                    ERROR_PREFIX + e.getMessage()));
        }
    }

    @Override
    public boolean isEnabled() {
        return mcpPort.isRunning(serverName);
    }

    CallOutcome<ToolResult> invoke(Map<String, Object> parameters) throws InterruptedException {
        CompletableFuture<ToolResult> pending = mcpPort.callTool(serverName, remoteToolName, parameters);
        ToolResult result;
        try {
            result = pending.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return CallOutcome.failure("timed out after " + callTimeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return CallOutcome.failure(cause.getMessage() != null ? cause.getMessage() : cause.toString());
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        }

        if (result == null) {
            return CallOutcome.failure("empty result");
        }
        if (result.isSuccess()) {
            return CallOutcome.success(result);
        }
        ToolFailureKind kind = result.getFailureKind();
        if (kind != null && kind.isDenial()) {
            return CallOutcome.denied(result, result.getError());
        }
        return CallOutcome.failure(result, result.getError());
    }

    ToolResult toToolResult(GuardResult<ToolResult> guarded) {
        return switch (guarded.getStatus()) {
        case SUCCESS -> guarded.getValue();
        case POLICY_DENIED -> guarded.getValue() != null
                ? guarded.getValue()
                : ToolResult.failure(ToolFailureKind.POLICY_DENIED, null, guarded.getError());
        case RATE_LIMITED, BULKHEAD_REJECTED, CIRCUIT_OPEN -> ToolResult.failure(
                ToolFailureKind.GOVERNANCE_REJECTED, guarded.getRejectionKind().getErrorType(),
                ERROR_PREFIX + guarded.getError());
        case CANCELLED -> ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, ERROR_TYPE_CANCELLED,
                ERROR_PREFIX + guarded.getError());
        case OPERATION_FAILED -> ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, ERROR_TYPE_GENERIC,
                ERROR_PREFIX + guarded.getError());
        };
    }

    /**
     * Namespaced tool name {@code mcp_{server}_{tool}}, restricted to
     * {@code [A-Za-z0-9_-]} and at most 64 characters.
     */
    static String qualifiedName(String serverName, String toolName) {
        String raw = "mcp_" + serverName + "_" + toolName;
        StringBuilder sanitized = new StringBuilder(Math.min(raw.length(), MAX_TOOL_NAME_LENGTH));
        for (int i = 0; i < raw.length() && sanitized.length() < MAX_TOOL_NAME_LENGTH; i++) {
            char c = raw.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '_' || c == '-';
            sanitized.append(allowed ? c : '_');
        }
        return sanitized.toString();
    }

    /**
     * Classify a free-form MCP error message into a machine-readable error type.
     */
    public static String classifyErrorType(String error) {
        if (error == null) {
            return ERROR_TYPE_GENERIC;
        }
        String lower = error.toLowerCase(Locale.ROOT);
        if (lower.contains("rate-limited")) {
            return RejectionKind.RATE_LIMITED.getErrorType();
        }
        if (lower.contains("busy; exceeded queue wait")) {
            return RejectionKind.BULKHEAD_REJECTED.getErrorType();
        }
        if (lower.contains("circuit open")) {
            return RejectionKind.CIRCUIT_OPEN.getErrorType();
        }
        return ERROR_TYPE_GENERIC;
    }
}
