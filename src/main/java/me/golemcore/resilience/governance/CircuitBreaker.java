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
import me.golemcore.resilience.domain.model.CircuitBreakerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * Failure-tracking state machine for one target.
 *
 * <p>
 * Transitions:
 * <ul>
 * <li><b>CLOSED</b> - calls pass. Failures increment
 * {@code consecutiveFailures}, successes reset it. Reaching
 * {@code failureThreshold} opens the breaker</li>
 * <li><b>OPEN</b> - every call is rejected until {@code cooldown} has elapsed
 * since {@code openedAt}, then the breaker moves to HALF_OPEN</li>
 * <li><b>HALF_OPEN</b> - exactly one probe is admitted; concurrent calls are
 * rejected while it runs. A successful probe closes the breaker, a failed one
 * reopens it and restarts the cooldown</li>
 * </ul>
 *
 * <p>
 * Outcomes of non-probe calls that complete after the breaker left CLOSED are
 * ignored: only the probe decides how HALF_OPEN resolves. All methods
 * synchronize on the instance, giving a single authoritative state per target.
 *
 * @since 1.0
 */
@Slf4j
public class CircuitBreaker {

    private final String target;
    private final int failureThreshold;
    private final Duration cooldown;

    private BreakerStatus status = BreakerStatus.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean probeInFlight;

    public CircuitBreaker(String target, int failureThreshold, Duration cooldown) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        this.target = target;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
    }

    /**
     * Decide whether a call may proceed at {@code now}. A permitted probe must be
     * followed by exactly one of {@link #onSuccess}, {@link #onFailure} or
     * {@link #onReleased}.
     */
    public synchronized BreakerDecision tryAcquire(Instant now) {
        if (status == BreakerStatus.CLOSED) {
            return BreakerDecision.PERMITTED;
        }

        if (status == BreakerStatus.OPEN) {
            Instant reopenAt = openedAt.plus(cooldown);
            if (now.isBefore(reopenAt)) {
                return BreakerDecision.rejected(Duration.between(now, reopenAt));
            }
            status = BreakerStatus.HALF_OPEN;
            log.info("[Breaker] '{}' cooldown elapsed, half-open", target);
        }

        if (probeInFlight) {
            return BreakerDecision.rejected(Duration.ZERO);
        }
        probeInFlight = true;
        return BreakerDecision.PROBE;
    }

    public synchronized void onSuccess(boolean probe) {
        if (probe) {
            probeInFlight = false;
            if (status == BreakerStatus.HALF_OPEN) {
                status = BreakerStatus.CLOSED;
                consecutiveFailures = 0;
                openedAt = null;
                log.info("[Breaker] '{}' probe succeeded, closed", target);
            }
            return;
        }
        if (status == BreakerStatus.CLOSED) {
            consecutiveFailures = 0;
        }
    }

    public synchronized void onFailure(boolean probe, Instant now) {
        if (probe) {
            probeInFlight = false;
            if (status == BreakerStatus.HALF_OPEN) {
                open(now);
                log.warn("[Breaker] '{}' probe failed, reopened for {}ms", target, cooldown.toMillis());
            }
            return;
        }
        if (status != BreakerStatus.CLOSED) {
            return;
        }
        consecutiveFailures++;
        if (consecutiveFailures >= failureThreshold) {
            open(now);
            log.warn("[Breaker] '{}' opened after {} consecutive failures", target, consecutiveFailures);
        }
    }

    /**
     * Release an admitted call without an outcome (explicit denial, bulkhead
     * rejection, cancellation). Frees the probe slot without a transition.
     */
    public synchronized void onReleased(boolean probe) {
        if (probe) {
            probeInFlight = false;
        }
    }

    public synchronized CircuitBreakerState getState() {
        return CircuitBreakerState.builder()
                .target(target)
                .status(status)
                .consecutiveFailures(consecutiveFailures)
                .openedAt(openedAt)
                .failureThreshold(failureThreshold)
                .cooldown(cooldown)
                .probeInFlight(probeInFlight)
                .build();
    }

    public synchronized BreakerStatus getStatus() {
        return status;
    }

    private void open(Instant now) {
        status = BreakerStatus.OPEN;
        openedAt = now;
    }
}
