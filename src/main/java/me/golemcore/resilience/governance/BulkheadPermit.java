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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped bulkhead slot. Closing it frees the slot (or hands it to the next
 * queued waiter). Closing more than once is a no-op, so it is safe to use in
 * try-with-resources alongside explicit release paths.
 */
public final class BulkheadPermit implements AutoCloseable {

    private final Bulkhead bulkhead;
    private final AtomicBoolean released = new AtomicBoolean(false);

    BulkheadPermit(Bulkhead bulkhead) {
        this.bulkhead = bulkhead;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            bulkhead.release();
        }
    }

    public boolean isReleased() {
        return released.get();
    }
}
