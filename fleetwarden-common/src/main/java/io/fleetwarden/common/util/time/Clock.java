/*
 * Copyright 2026 Fleetwarden Authors.
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
 */

package io.fleetwarden.common.util.time;

/**
 * Wall clock abstraction, so time dependent logic can be driven by a {@link TestClock} in tests.
 */
public interface Clock {

    /**
     * Current time in milliseconds, equivalent to {@link System#currentTimeMillis()}.
     */
    long wallTime();

    /**
     * Returns true, if the given timestamp is strictly in the future.
     */
    default boolean isBefore(long timestamp) {
        return wallTime() < timestamp;
    }

    /**
     * Milliseconds elapsed since the given timestamp (negative if the timestamp is in the future).
     */
    default long elapsedSince(long timestamp) {
        return wallTime() - timestamp;
    }
}
