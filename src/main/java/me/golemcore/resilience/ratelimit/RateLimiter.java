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

import java.util.List;
import java.util.Optional;

/**
 * Per-target admission counter.
 *
 * <p>
 * {@link #allow(String)} admits or rejects one call for the given target.
 * Rejections never consume capacity.
 *
 * @since 1.0
 * @see FixedWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Check and consume one admit for a target.
     */
    RateLimitResult allow(String target);

    /**
     * Get current window state, if the target has been seen.
     */
    Optional<RateWindowState> getWindowState(String target);

    /**
     * Get window state for every known target.
     */
    List<RateWindowState> getWindowStates();
}
