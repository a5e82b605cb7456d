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

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of the OTLP export pipeline.
 */
@Value
@Builder
public class ExportStatus {

    boolean enabled;
    String endpoint;
    int queueDepth;
    int queueCapacity;
    long sent;
    long queueFullDrops;
    long retriesExhaustedDrops;

    public static ExportStatus disabled() {
        return ExportStatus.builder().enabled(false).build();
    }
}
