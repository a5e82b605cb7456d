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

import java.time.Duration;

/**
 * Admission decision of a {@link CircuitBreaker}.
 *
 * @param permitted
 *            whether the call may proceed
 * @param probe
 *            whether the call is the single HalfOpen recovery probe
 * @param retryAfter
 *            for rejections, time until the breaker may admit again
 */
public record BreakerDecision(boolean permitted, boolean probe, Duration retryAfter) {

    static final BreakerDecision PERMITTED = new BreakerDecision(true, false, Duration.ZERO);
    static final BreakerDecision PROBE = new BreakerDecision(true, true, Duration.ZERO);

    static BreakerDecision rejected(Duration retryAfter) {
        return new BreakerDecision(false, false, retryAfter);
    }
}
