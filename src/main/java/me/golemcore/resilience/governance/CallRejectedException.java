package me.golemcore.resilience.governance;

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

import me.golemcore.resilience.domain.model.RejectionKind;

import java.time.Duration;

/**
 * Thrown by {@code GuardResult.orElseThrow()} when a gate refused the call. The
 * operation never ran.
 */
public class CallRejectedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String target;
    private final RejectionKind kind;
    private final transient Duration retryAfter;

    public CallRejectedException(String target, RejectionKind kind, Duration retryAfter, String message) {
        super(message);
        this.target = target;
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public String getTarget() {
        return target;
    }

    public RejectionKind getKind() {
        return kind;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
