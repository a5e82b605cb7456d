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
import me.golemcore.resilience.infrastructure.config.ResilienceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the effective {@link GovernancePolicy} for a target.
 *
 * <p>
 * Per-target overrides from {@code resilience.mcp.targets.<target>.*} win over
 * {@code resilience.mcp.defaults.*}. Out-of-range values are clamped (capacity,
 * rate limit and failure threshold to at least 1, queue wait and cooldown to at
 * least 0). The first resolution for a target is cached for the process
 * lifetime, so every gate of that target sees the same policy.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class GovernancePolicyResolver {

    private final ResilienceProperties properties;
    private final Map<String, GovernancePolicy> resolved = new ConcurrentHashMap<>();

    public GovernancePolicyResolver(ResilienceProperties properties) {
        this.properties = properties;
    }

    public GovernancePolicy resolve(String target) {
        return resolved.computeIfAbsent(target, this::build);
    }

    private GovernancePolicy build(String target) {
        ResilienceProperties.GovernanceDefaults defaults = properties.getMcp().getDefaults();
        ResilienceProperties.GovernanceOverrides overrides = properties.getMcp().getTargets().get(target);

        int maxConcurrent = defaults.getMaxConcurrentRequests();
        long queueWaitMs = defaults.getQueueWaitMs();
        int ratePerMinute = defaults.getRateLimitPerMinute();
        int failureThreshold = defaults.getFailureThreshold();
        long cooldownMs = defaults.getCooldownMs();

        if (overrides != null) {
            if (overrides.getMaxConcurrentRequests() != null) {
                maxConcurrent = overrides.getMaxConcurrentRequests();
            }
            if (overrides.getQueueWaitMs() != null) {
                queueWaitMs = overrides.getQueueWaitMs();
            }
            if (overrides.getRateLimitPerMinute() != null) {
                ratePerMinute = overrides.getRateLimitPerMinute();
            }
            if (overrides.getFailureThreshold() != null) {
                failureThreshold = overrides.getFailureThreshold();
            }
            if (overrides.getCooldownMs() != null) {
                cooldownMs = overrides.getCooldownMs();
            }
        }

        GovernancePolicy policy = GovernancePolicy.builder()
                .maxConcurrentRequests(atLeast(target, "max-concurrent-requests", maxConcurrent, 1))
                .queueWait(Duration.ofMillis(atLeast(target, "queue-wait-ms", queueWaitMs, 0)))
                .rateLimitPerMinute(atLeast(target, "rate-limit-per-minute", ratePerMinute, 1))
                .failureThreshold(atLeast(target, "failure-threshold", failureThreshold, 1))
                .cooldown(Duration.ofMillis(atLeast(target, "cooldown-ms", cooldownMs, 0)))
                .build();
        log.debug("[Governor] Policy for '{}': {}", target, policy);
        return policy;
    }

    private static int atLeast(String target, String key, int value, int min) {
        return (int) atLeast(target, key, (long) value, min);
    }

    private static long atLeast(String target, String key, long value, long min) {
        if (value < min) {
            log.warn("[Governor] Invalid {}={} for target '{}', using {}", key, value, target, min);
            return min;
        }
        return value;
    }
}
