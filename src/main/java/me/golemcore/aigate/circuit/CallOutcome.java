package me.golemcore.aigate.circuit;

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
 * Outcome of a call as seen by a circuit breaker.
 */
public enum CallOutcome {

    SUCCESS,

    /**
     * Provider-side failure: exception of a counted class, timeout or
     * cancellation.
     */
    FAILURE,

    /**
     * Failure of a class the breaker does not count (caller misuse). Leaves
     * state untouched apart from releasing a trial slot.
     */
    IGNORED
}
