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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "fleetwarden.reconciler")
public interface TimeoutReconcilerConfiguration {

    /**
     * How long a group stays timed out, counted from the start of the activity that caused the timeout.
     */
    @DefaultValue("3600000")
    long getTimeoutMs();

    /**
     * Activities started longer ago than this are not examined.
     */
    @DefaultValue("3600000")
    long getActivityStalenessMs();

    /**
     * A spot request still unfulfilled after this time is cancelled.
     */
    @DefaultValue("300000")
    long getSpotRequestTimeoutMs();

    /**
     * A spot group is timed out when its per zone outbid time, averaged over the outbid zones, exceeds this value.
     */
    @DefaultValue("1200000")
    long getMaxAverageOutbidMs();

    @DefaultValue("18000000")
    long getSpotPriceHistoryPeriodMs();

    /**
     * Name fragment of groups restricted to a single availability zone. Only these are timed out on zone capacity
     * shortage.
     */
    @DefaultValue("only-az")
    String getAzRestrictedGroupMarker();

    /**
     * Maximum number of regions whose activities are fetched in parallel.
     */
    @DefaultValue("8")
    int getRegionConcurrency();
}
