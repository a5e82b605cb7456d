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

/**
 * Thread-safe fixed (non-sliding) one-minute admission window.
 *
 * <p>
 * The window is keyed by the integer minute number derived from wall-clock
 * time ({@code epochMillis / 60000}):
 * <ul>
 * <li>When the current minute differs from the stored one, count resets to 0
 * and the window adopts the new minute</li>
 * <li>While {@code count < limit}, each call increments count and is
 * admitted</li>
 * <li>Otherwise the call is rejected and count is left untouched</li>
 * </ul>
 *
 * <p>
 * The reset, check and increment run under the window's monitor so concurrent
 * callers can never over-admit.
 *
 * @since 1.0
 */
public class FixedWindow {

    static final long WINDOW_MILLIS = 60_000L;

    private final int limit;
    private long windowStartMinute;
    private int count;

    public FixedWindow(int limit, long currentMinute) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        this.limit = limit;
        this.windowStartMinute = currentMinute;
    }

    /**
     * Try to admit one call at the given wall-clock time.
     */
    public synchronized RateLimitResult tryAcquire(long epochMillis) {
        long minute = Math.floorDiv(epochMillis, WINDOW_MILLIS);
        if (minute != windowStartMinute) {
            windowStartMinute = minute;
            count = 0;
        }

        if (count < limit) {
            count++;
            return RateLimitResult.allowed(limit - count);
        }

        long waitMs = (windowStartMinute + 1) * WINDOW_MILLIS - epochMillis;
        return RateLimitResult.denied(waitMs, "Rate limit exceeded");
    }

    /**
     * Get current state of the window.
     */
    public synchronized RateWindowState getState(String target) {
        return RateWindowState.builder()
                .target(target)
                .windowStartMinute(windowStartMinute)
                .count(count)
                .limit(limit)
                .build();
    }

    public int getLimit() {
        return limit;
    }
}
