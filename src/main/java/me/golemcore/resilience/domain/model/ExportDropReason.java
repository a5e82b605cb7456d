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

/**
 * Why a metrics snapshot was permanently dropped by the export pipeline.
 */
public enum ExportDropReason {

    /** Export queue was at capacity when the sampler tried to enqueue. */
    QUEUE_FULL("queue_full"),

    /** Every send attempt failed and the retry budget was exhausted. */
    RETRIES_EXHAUSTED("retries_exhausted");

    private final String code;

    ExportDropReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
