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

import me.golemcore.resilience.domain.model.GovernancePolicy;

/**
 * Bulkhead and breaker owned by one target. Each gate synchronizes
 * independently.
 */
public record TargetGates(String target, GovernancePolicy policy, Bulkhead bulkhead, CircuitBreaker breaker) {

    static TargetGates create(String target, GovernancePolicy policy) {
        return new TargetGates(
                target,
                policy,
                new Bulkhead(policy.getMaxConcurrentRequests()),
                new CircuitBreaker(target, policy.getFailureThreshold(), policy.getCooldown()));
    }
}
