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

import me.golemcore.resilience.domain.model.CallOutcome;

/**
 * Caller-supplied work executed by {@link CallGovernor} once every gate has
 * admitted it. Throwing is treated as a failure, except
 * {@link InterruptedException}, which cancels the call.
 *
 * @param <T>
 *            result value type
 */
@FunctionalInterface
public interface GovernedOperation<T> {

    CallOutcome<T> execute() throws Exception;
}
