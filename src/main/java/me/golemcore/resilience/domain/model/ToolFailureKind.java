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

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * Tool execution was blocked because user confirmation was required but denied.
     */
    CONFIRMATION_DENIED,

    /**
     * Tool execution was denied by policy (e.g. tool unknown, disabled, skill
     * unavailable).
     */
    POLICY_DENIED,

    /**
     * Tool call was rejected by call governance (rate limit, bulkhead, open
     * circuit) before reaching the tool server.
     */
    GOVERNANCE_REJECTED,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, non-zero exit,
     * etc.).
     */
    EXECUTION_FAILED;

    /**
     * Whether this failure is an explicit denial that happened before any work
     * was attempted.
     */
    public boolean isDenial() {
        return this == CONFIRMATION_DENIED || this == POLICY_DENIED;
    }
}
