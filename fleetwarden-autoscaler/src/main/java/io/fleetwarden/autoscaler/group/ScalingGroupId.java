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

import java.util.Objects;

/**
 * Identity of a scaling group. Group names are unique within a region only.
 */
public final class ScalingGroupId {

    private final String region;
    private final String name;

    private ScalingGroupId(String region, String name) {
        this.region = region;
        this.name = name;
    }

    public String getRegion() {
        return region;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScalingGroupId that = (ScalingGroupId) o;
        return Objects.equals(region, that.region) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, name);
    }

    @Override
    public String toString() {
        return region + '/' + name;
    }

    public static ScalingGroupId of(String region, String name) {
        return new ScalingGroupId(region, name);
    }
}
