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

import me.golemcore.resilience.governance.CallFailedException;
import me.golemcore.resilience.governance.CallRejectedException;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of {@code CallGovernor.guard}.
 *
 * <p>
 * Rejections carry a {@link RejectionKind} and a retry-after hint. Operation
 * results carry the value returned by the operation (which may be present even
 * for failures and denials, e.g. a failed {@link ToolResult}).
 *
 * @param <T>
 *            operation value type
 */
@Data
@Builder
public class GuardResult<T> {

    private String target;
    private GuardStatus status;
    private T value;
    private String error;
    private Throwable cause;
    private Duration retryAfter;

    public boolean isSuccess() {
        return status == GuardStatus.SUCCESS;
    }

    public boolean isRejected() {
        return status != null && status.isRejection();
    }

    public RejectionKind getRejectionKind() {
        return status != null ? status.getRejectionKind() : null;
    }

    /**
     * Returns the operation value, throwing for rejections and failures.
     *
     * @throws CallRejectedException
     *             if the call was refused by a gate
     * @throws CallFailedException
     *             if the operation failed, was denied or was cancelled
     */
    public T orElseThrow() {
        if (isSuccess()) {
            return value;
        }
        if (isRejected()) {
            throw new CallRejectedException(target, getRejectionKind(), retryAfter, error);
        }
        throw new CallFailedException(target, status, error, cause);
    }

    public static <T> GuardResult<T> success(String target, T value) {
        return GuardResult.<T>builder()
                .target(target)
                .status(GuardStatus.SUCCESS)
                .value(value)
                .build();
    }

    public static <T> GuardResult<T> failed(String target, T value, String error, Throwable cause) {
        return GuardResult.<T>builder()
                .target(target)
                .status(GuardStatus.OPERATION_FAILED)
                .value(value)
                .error(error)
                .cause(cause)
                .build();
    }

    public static <T> GuardResult<T> denied(String target, T value, String reason) {
        return GuardResult.<T>builder()
                .target(target)
                .status(GuardStatus.POLICY_DENIED)
                .value(value)
                .error(reason)
                .build();
    }

    public static <T> GuardResult<T> rejected(String target, RejectionKind kind, Duration retryAfter, String reason) {
        return GuardResult.<T>builder()
                .target(target)
                .status(GuardStatus.of(kind))
                .retryAfter(retryAfter)
                .error(reason)
                .build();
    }

    public static <T> GuardResult<T> cancelled(String target, String reason) {
        return GuardResult.<T>builder()
                .target(target)
                .status(GuardStatus.CANCELLED)
                .error(reason)
                .build();
    }
}
