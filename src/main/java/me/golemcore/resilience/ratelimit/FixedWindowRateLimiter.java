package me.golemcore.resilience.ratelimit;

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

import me.golemcore.resilience.domain.model.RateLimitResult;
import me.golemcore.resilience.domain.model.RateWindowState;
import me.golemcore.resilience.governance.GovernancePolicyResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window rate limiter with one window per governed target.
 *
 * <p>
 * Windows are created lazily on first use with the target's
 * {@code rate-limit-per-minute} and never removed while the process runs. Each
 * {@link FixedWindow} owns its own lock, so contention on one target never
 * serializes calls to another.
 *
 * @since 1.0
 * @see FixedWindow
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    private final GovernancePolicyResolver policyResolver;
    private final Clock clock;

    private final Map<String, FixedWindow> windows = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult allow(String target) {
        long now = clock.millis();
        FixedWindow window = windows.computeIfAbsent(target, key -> new FixedWindow(
                policyResolver.resolve(key).getRateLimitPerMinute(),
                Math.floorDiv(now, FixedWindow.WINDOW_MILLIS)));

        RateLimitResult result = window.tryAcquire(now);
        if (!result.isAllowed()) {
            log.debug("[RateLimit] Target '{}' exceeded {}/min", target, window.getLimit());
        }
        return result;
    }

    @Override
    public Optional<RateWindowState> getWindowState(String target) {
        FixedWindow window = windows.get(target);
        if (window == null) {
            return Optional.empty();
        }
        return Optional.of(window.getState(target));
    }

    @Override
    public List<RateWindowState> getWindowStates() {
        return windows.entrySet().stream()
                .map(entry -> entry.getValue().getState(entry.getKey()))
                .toList();
    }
}
