package me.golemcore.resilience.adapter.outbound.otlp;

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

import me.golemcore.resilience.domain.model.ExportDropReason;
import me.golemcore.resilience.domain.model.MetricsSnapshot;

/**
 * Notified whenever the export pipeline permanently gives up on a snapshot.
 * Called on the enqueuing thread for {@link ExportDropReason#QUEUE_FULL} and
 * on the worker thread for {@link ExportDropReason#RETRIES_EXHAUSTED}.
 */
@FunctionalInterface
public interface ExportDropListener {

    void onDrop(ExportDropReason reason, MetricsSnapshot snapshot, int attempts);
}
