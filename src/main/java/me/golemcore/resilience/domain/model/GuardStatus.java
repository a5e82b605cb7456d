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
 * Terminal status of a governed call.
 */
public enum GuardStatus {

    /** Operation ran and reported success. */
    SUCCESS(null),

    /** Operation ran and failed; counted by the circuit breaker. */
    OPERATION_FAILED(null),

    /** Operation ran and reported an explicit denial; neutral for the breaker. */
    POLICY_DENIED(null),

    RATE_LIMITED(RejectionKind.RATE_LIMITED),

    BULKHEAD_REJECTED(RejectionKind.BULKHEAD_REJECTED),

    CIRCUIT_OPEN(RejectionKind.CIRCUIT_OPEN),

    /** Caller thread was interrupted while queued or while the operation ran. */
    CANCELLED(null);

    private final RejectionKind rejectionKind;

    GuardStatus(RejectionKind rejectionKind) {
        this.rejectionKind = rejectionKind;
    }

    public RejectionKind getRejectionKind() {
        return rejectionKind;
    }

    public boolean isRejection() {
        return rejectionKind != null;
    }

    public static GuardStatus of(RejectionKind kind) {
        return switch (kind) {
        case RATE_LIMITED -> RATE_LIMITED;
        case BULKHEAD_REJECTED -> BULKHEAD_REJECTED;
        case CIRCUIT_OPEN -> CIRCUIT_OPEN;
        };
    }
}
