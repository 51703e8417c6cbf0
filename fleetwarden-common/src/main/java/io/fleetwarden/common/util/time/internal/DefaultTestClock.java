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

package io.fleetwarden.common.util.time.internal;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import io.fleetwarden.common.util.time.TestClock;

public class DefaultTestClock implements TestClock {

    private volatile long wallTime;

    public DefaultTestClock(long initialWallTime) {
        this.wallTime = initialWallTime;
    }

    @Override
    public long advanceTime(long interval, TimeUnit timeUnit) {
        Preconditions.checkArgument(interval >= 0, "Cannot move the clock backwards: %s", interval);
        this.wallTime += timeUnit.toMillis(interval);
        return wallTime;
    }

    @Override
    public TestClock jumpTo(long wallTime) {
        Preconditions.checkArgument(wallTime >= this.wallTime, "Cannot move the clock backwards from %s to %s", this.wallTime, wallTime);
        this.wallTime = wallTime;
        return this;
    }

    @Override
    public long wallTime() {
        return wallTime;
    }
}
