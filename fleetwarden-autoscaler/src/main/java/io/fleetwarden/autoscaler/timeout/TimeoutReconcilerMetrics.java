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

package io.fleetwarden.autoscaler.timeout;

import java.util.concurrent.atomic.AtomicInteger;

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;

class TimeoutReconcilerMetrics {

    static final String ROOT = "fleetwarden.reconciler.";

    static final String TIMEOUTS = ROOT + "timeouts";
    static final String CAPACITY_CHANGES = ROOT + "capacityChanges";
    static final String SPOT_REQUEST_CANCELLATIONS = ROOT + "spotRequestCancellations";
    static final String SPOT_TIMED_OUT_GROUPS = ROOT + "spotTimedOutGroups";

    private final Registry registry;
    private final Id timeoutsId;
    private final Id capacityChangesId;
    private final Id spotRequestCancellationsId;
    private final AtomicInteger spotTimedOutGroups;

    TimeoutReconcilerMetrics(Registry registry) {
        this.registry = registry;
        this.timeoutsId = registry.createId(TIMEOUTS);
        this.capacityChangesId = registry.createId(CAPACITY_CHANGES);
        this.spotRequestCancellationsId = registry.createId(SPOT_REQUEST_CANCELLATIONS);
        this.spotTimedOutGroups = registry.gauge(SPOT_TIMED_OUT_GROUPS, new AtomicInteger(0));
    }

    void timedOut(TimeoutReason reason) {
        registry.counter(timeoutsId.withTag("reason", reason.name())).increment();
    }

    void capacityChanged(TimeoutReason reason, boolean dryRun) {
        registry.counter(capacityChangesId
                .withTag("reason", reason.name())
                .withTag("dryRun", Boolean.toString(dryRun))
        ).increment();
    }

    void spotRequestCancelled() {
        registry.counter(spotRequestCancellationsId).increment();
    }

    void setSpotTimedOutGroups(int count) {
        spotTimedOutGroups.set(count);
    }
}
