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

package io.fleetwarden.api.connector.cloud;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Synchronous, region scoped access to the cloud provider's scaling group, activity and spot market APIs. All
 * methods block the calling thread until the provider responds. Provider failures are propagated unchanged,
 * unless stated otherwise.
 */
public interface ScalingGroupConnector {

    /**
     * Returns all scaling groups in a region, following the provider pagination to the end.
     */
    List<InstanceGroup> getInstanceGroups(String region);

    /**
     * Returns launch configurations with the given names. Unknown names are silently omitted.
     */
    List<InstanceLaunchConfiguration> getLaunchConfigurations(String region, List<String> launchConfigurationNames);

    /**
     * Sets the desired capacity of a group to an exact value, without honoring the group's cooldown period.
     */
    void setDesiredCapacity(String region, String groupId, int desired);

    /**
     * Terminates an instance of a scaling group.
     *
     * @throws CloudConnectorException with {@link CloudConnectorException.ErrorCode#MinSizeViolation} if the
     *                                 provider refuses the request, because the group would drop below its min size
     */
    void terminateInstance(String region, String instanceId, boolean decrementDesiredCapacity);

    /**
     * Returns a single page of scaling activities of all groups in a region, newest first.
     *
     * @param pageToken null for the first page
     */
    Page<ScalingActivity> getScalingActivities(String region, String pageToken);

    /**
     * Returns {@link Optional#empty()} if the provider does not know a spot request with the given id.
     */
    Optional<SpotInstanceRequest> findSpotInstanceRequest(String region, String requestId);

    void cancelSpotInstanceRequest(String region, String requestId);

    /**
     * Returns all spot price observations for the given instance types, recorded since the given timestamp.
     */
    List<SpotPrice> getSpotPriceHistory(String region, Collection<String> instanceTypes, long startTime);
}
