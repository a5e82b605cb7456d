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

import me.golemcore.resilience.domain.model.MetricsSnapshot;

import java.time.Instant;
import java.util.Comparator;

/**
 * One snapshot waiting in the {@link ExportQueue}.
 *
 * <p>
 * Attempt count and schedule are mutated only by the export worker, and only
 * while the item is out of the queue.
 */
public final class ExportItem {

    static final Comparator<ExportItem> SCHEDULE_ORDER = Comparator
            .comparing(ExportItem::getNotBeforeTime)
            .thenComparingLong(ExportItem::getSequence);

    private final MetricsSnapshot snapshot;
    private final long sequence;
    private int attemptCount;
    private Instant notBeforeTime;

    ExportItem(MetricsSnapshot snapshot, long sequence, Instant notBeforeTime) {
        this.snapshot = snapshot;
        this.sequence = sequence;
        this.notBeforeTime = notBeforeTime;
    }

    public MetricsSnapshot getSnapshot() {
        return snapshot;
    }

    public long getSequence() {
        return sequence;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public Instant getNotBeforeTime() {
        return notBeforeTime;
    }

    void scheduleRetry(int attempts, Instant notBefore) {
        this.attemptCount = attempts;
        this.notBeforeTime = notBefore;
    }

    ExportItem copy() {
        ExportItem copy = new ExportItem(snapshot, sequence, notBeforeTime);
        copy.attemptCount = attemptCount;
        return copy;
    }
}
