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

package io.fleetwarden.autoscaler.group;

import java.util.Collections;
import java.util.List;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "fleetwarden.catalog")
public interface GroupCatalogConfiguration {

    /**
     * Provider regions scanned for cluster groups.
     */
    default List<String> getRegions() {
        return Collections.singletonList("us-west-2");
    }

    /**
     * Value of the cluster tag a group must carry to be managed. If empty, groups are not filtered by tags.
     */
    @DefaultValue("")
    String getClusterName();

    /**
     * Maximum number of launch configurations requested in one provider call.
     */
    @DefaultValue("50")
    int getLaunchConfigurationBatchSize();

    @DefaultValue("8")
    int getRegionConcurrency();
}
