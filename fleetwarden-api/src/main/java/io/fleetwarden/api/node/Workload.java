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

package io.fleetwarden.api.node;

import java.util.Map;
import java.util.Set;

/**
 * The scheduling requirements of a workload, used to decide which scaling group can host it.
 */
public interface Workload {

    /**
     * Node labels the workload must be placed on.
     */
    Map<String, String> getSelectors();

    /**
     * True if the workload tolerates every NoSchedule taint.
     */
    boolean hasNoScheduleWildcardToleration();

    /**
     * Keys of NoSchedule taints the workload tolerates regardless of the taint value.
     */
    Set<String> getNoScheduleExistentialTolerations();
}
