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

import java.util.Objects;

/**
 * Typed outcome reported by a governed operation.
 *
 * <p>
 * The governor never infers failure from a generic error: only
 * {@link Kind#FAILURE} feeds circuit breaker bookkeeping. {@link Kind#DENIED}
 * covers explicit denials (policy blocks, declined confirmations) that happened
 * before any work reached the target.
 *
 * @param kind
 *            outcome classification
 * @param value
 *            operation result, may be null
 * @param error
 *            error text for failures and denials
 */
public record CallOutcome<T>(Kind kind, T value, String error) {

    public enum Kind {
        SUCCESS, FAILURE, DENIED
    }

    public CallOutcome {
        Objects.requireNonNull(kind, "kind");
    }

    public static <T> CallOutcome<T> success(T value) {
        return new CallOutcome<>(Kind.SUCCESS, value, null);
    }

    public static <T> CallOutcome<T> failure(String error) {
        return new CallOutcome<>(Kind.FAILURE, null, error);
    }

    public static <T> CallOutcome<T> failure(T value, String error) {
        return new CallOutcome<>(Kind.FAILURE, value, error);
    }

    public static <T> CallOutcome<T> denied(T value, String reason) {
        return new CallOutcome<>(Kind.DENIED, value, reason);
    }
}
