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

import me.golemcore.resilience.domain.model.BreakerStatus;
import me.golemcore.resilience.domain.model.BulkheadState;
import me.golemcore.resilience.domain.model.CallOutcome;
import me.golemcore.resilience.domain.model.GuardResult;
import me.golemcore.resilience.domain.model.RateLimitResult;
import me.golemcore.resilience.domain.model.RejectionKind;
import me.golemcore.resilience.domain.model.TargetGovernanceState;
import me.golemcore.resilience.infrastructure.config.ResilienceProperties;
import me.golemcore.resilience.ratelimit.RateLimiter;
import me.golemcore.resilience.telemetry.McpMetricNames;
import me.golemcore.resilience.telemetry.MetricsRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Admission control around outbound calls to governed targets (MCP servers).
 *
 * <p>
 * Gates run cheapest and most decisive first:
 * <ol>
 * <li>{@link RateLimiter} - reject as {@code RATE_LIMITED}</li>
 * <li>{@link CircuitBreaker} - reject as {@code CIRCUIT_OPEN} while open, or
 * while a half-open probe is in flight</li>
 * <li>{@link Bulkhead} - reject as {@code BULKHEAD_REJECTED} when the queue
 * wait times out</li>
 * </ol>
 * Only then does the operation run, holding the bulkhead permit until it
 * returns. The permit and any half-open probe slot are released on every exit
 * path.
 *
 * <p>
 * Metrics: {@code mcp_calls} counts operations that actually executed,
 * including ones that failed. Every rejection increments exactly one of the
 * three rejection counters. Rejections are never retried here; retry policy
 * belongs to the caller.
 *
 * <p>
 * Only {@link CallOutcome.Kind#FAILURE} (or an exception thrown by the
 * operation) counts against the breaker. Explicit denials are neutral.
 *
 * @since 1.0
 * @see GovernedOperation
 * @see GuardResult
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallGovernor {

    private final ResilienceProperties properties;
    private final RateLimiter rateLimiter;
    private final TargetGatesRegistry gatesRegistry;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    /**
     * Run {@code operation} against {@code target} if every gate admits it.
     * Blocks only while queued in the target's bulkhead.
     */
    public <T> GuardResult<T> guard(String target, GovernedOperation<T> operation) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(operation, "operation");

        if (!properties.getMcp().isEnabled()) {
            return execute(target, operation, null, false);
        }

        TargetGates gates = gatesRegistry.forTarget(target);

        RateLimitResult rateLimit = rateLimiter.allow(target);
        if (!rateLimit.isAllowed()) {
            Duration wait = rateLimit.getWaitTime();
            return reject(target, RejectionKind.RATE_LIMITED, wait,
                    "rate-limited; retry in " + toRetrySeconds(wait) + "s");
        }

        CircuitBreaker breaker = gates.breaker();
        BreakerDecision decision = breaker.tryAcquire(clock.instant());
        if (!decision.permitted()) {
            Duration wait = decision.retryAfter();
            return reject(target, RejectionKind.CIRCUIT_OPEN, wait,
                    "circuit open; retry in " + toRetrySeconds(wait) + "s");
        }
        boolean probe = decision.probe();

        Duration queueWait = gates.policy().getQueueWait();
        Optional<BulkheadPermit> permit;
        try {
            permit = gates.bulkhead().acquire(queueWait);
        } catch (InterruptedException e) {
            breaker.onReleased(probe);
            Thread.currentThread().interrupt();
            log.debug("[Governor] Call to '{}' cancelled while queued", target);
            return GuardResult.cancelled(target, "cancelled while waiting for a free slot");
        }
        if (permit.isEmpty()) {
            breaker.onReleased(probe);
            return reject(target, RejectionKind.BULKHEAD_REJECTED, Duration.ZERO,
                    "busy; exceeded queue wait of " + queueWait.toMillis() + "ms");
        }

        try (BulkheadPermit held = permit.get()) {
            return execute(target, operation, breaker, probe);
        }
    }

    /**
     * Refresh governance gauges in the metrics registry.
     */
    public void publishGauges() {
        int targets = 0;
        int inFlight = 0;
        int queued = 0;
        int open = 0;
        for (TargetGates gates : gatesRegistry.all()) {
            targets++;
            BulkheadState bulkhead = gates.bulkhead().getState(gates.target());
            inFlight += bulkhead.getInFlight();
            queued += bulkhead.getQueued();
            if (gates.breaker().getStatus() != BreakerStatus.CLOSED) {
                open++;
            }
        }
        metricsRegistry.setGauge(McpMetricNames.GOVERNED_TARGETS, targets);
        metricsRegistry.setGauge(McpMetricNames.BULKHEAD_IN_FLIGHT, inFlight);
        metricsRegistry.setGauge(McpMetricNames.BULKHEAD_QUEUED, queued);
        metricsRegistry.setGauge(McpMetricNames.CIRCUIT_OPEN_TARGETS, open);
    }

    /**
     * Snapshot of every gate for every target seen so far, sorted by target.
     */
    public List<TargetGovernanceState> describeTargets() {
        return gatesRegistry.all().stream()
                .sorted(Comparator.comparing(TargetGates::target))
                .map(gates -> TargetGovernanceState.builder()
                        .target(gates.target())
                        .policy(gates.policy())
                        .rateWindow(rateLimiter.getWindowState(gates.target()).orElse(null))
                        .bulkhead(gates.bulkhead().getState(gates.target()))
                        .breaker(gates.breaker().getState())
                        .build())
                .toList();
    }

    private <T> GuardResult<T> execute(String target, GovernedOperation<T> operation, CircuitBreaker breaker,
            boolean probe) {
        metricsRegistry.increment(McpMetricNames.CALLS);
        boolean recorded = false;
        try {
            CallOutcome<T> outcome = operation.execute();
            if (outcome == null) {
                recordFailure(breaker, probe);
                recorded = true;
                return GuardResult.failed(target, null, "operation returned no outcome", null);
            }
            switch (outcome.kind()) {
            case SUCCESS -> {
                if (breaker != null) {
                    breaker.onSuccess(probe);
                }
                recorded = true;
                return GuardResult.success(target, outcome.value());
            }
            case DENIED -> {
                if (breaker != null) {
                    breaker.onReleased(probe);
                }
                recorded = true;
                return GuardResult.denied(target, outcome.value(), outcome.error());
            }
            default -> {
                recordFailure(breaker, probe);
                recorded = true;
                return GuardResult.failed(target, outcome.value(), outcome.error(), null);
            }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[Governor] Call to '{}' interrupted", target);
            return GuardResult.cancelled(target, "cancelled while running");
        } catch (Exception e) {
            recordFailure(breaker, probe);
            recorded = true;
            log.debug("[Governor] Call to '{}' failed: {}", target, e.getMessage());
            return GuardResult.failed(target, null, e.getMessage() != null ? e.getMessage() : e.toString(), e);
        } finally {
            if (!recorded && breaker != null) {
                breaker.onReleased(probe);
            }
        }
    }

    private void recordFailure(CircuitBreaker breaker, boolean probe) {
        if (breaker != null) {
            breaker.onFailure(probe, clock.instant());
        }
    }

    private <T> GuardResult<T> reject(String target, RejectionKind kind, Duration retryAfter, String reason) {
        metricsRegistry.increment(kind.getCounterName());
        log.debug("[Governor] Rejected call to '{}': {}", target, reason);
        return GuardResult.rejected(target, kind, retryAfter, reason);
    }

    static long toRetrySeconds(Duration wait) {
        if (wait == null || wait.isNegative() || wait.isZero()) {
            return 1;
        }
        long millis = wait.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
