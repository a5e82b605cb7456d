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

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable point-in-time copy of the metrics registry.
 *
 * @param timestamp
 *            when the snapshot was taken
 * @param counters
 *            counter values by name, sorted by name
 * @param gauges
 *            gauge values by name, sorted by name
 */
public record MetricsSnapshot(Instant timestamp, Map<String, Long> counters, Map<String, Double> gauges) {

    public MetricsSnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        counters = Collections.unmodifiableMap(new TreeMap<>(counters));
        gauges = Collections.unmodifiableMap(new TreeMap<>(gauges));
    }

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public double gauge(String name) {
        return gauges.getOrDefault(name, 0.0);
    }
}
