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

/**
 * A cluster-visible worker node backed by a cloud instance.
 */
public interface ClusterNode {

    String getInstanceId();

    boolean isUnschedulable();

    /**
     * Makes the node schedulable again.
     *
     * @return true if the node was uncordoned
     */
    boolean uncordon();
}
