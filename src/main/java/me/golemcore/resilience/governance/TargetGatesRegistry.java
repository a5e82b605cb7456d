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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-target bulkheads and circuit breakers, keyed by target name.
 *
 * <p>
 * Entries are created lazily on first use from the target's resolved policy
 * and are never removed while the process runs. There is no global lock: the
 * map only guards entry creation.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class TargetGatesRegistry {

    private final GovernancePolicyResolver policyResolver;
    private final Map<String, TargetGates> gates = new ConcurrentHashMap<>();

    public TargetGates forTarget(String target) {
        return gates.computeIfAbsent(target, key -> TargetGates.create(key, policyResolver.resolve(key)));
    }

    public Optional<TargetGates> find(String target) {
        return Optional.ofNullable(gates.get(target));
    }

    public Collection<TargetGates> all() {
        return Collections.unmodifiableCollection(gates.values());
    }
}
