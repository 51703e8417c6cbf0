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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.fleetwarden.common.util.CollectionsExt;

/**
 * Provider snapshot of a scaling group, as returned by a single listing call.
 */
public class InstanceGroup {

    private final String id;
    private final String launchConfigurationName;
    private final int min;
    private final int desired;
    private final int max;
    private final Map<String, String> tags;
    private final List<String> instanceIds;

    public InstanceGroup(String id,
                         String launchConfigurationName,
                         int min,
                         int desired,
                         int max,
                         Map<String, String> tags,
                         List<String> instanceIds) {
        this.id = id;
        this.launchConfigurationName = launchConfigurationName;
        this.min = min;
        this.desired = desired;
        this.max = max;
        this.tags = Collections.unmodifiableMap(CollectionsExt.nonNull(tags));
        this.instanceIds = Collections.unmodifiableList(CollectionsExt.nonNull(instanceIds));
    }

    public String getId() {
        return id;
    }

    public String getLaunchConfigurationName() {
        return launchConfigurationName;
    }

    public int getMin() {
        return min;
    }

    public int getDesired() {
        return desired;
    }

    public int getMax() {
        return max;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public List<String> getInstanceIds() {
        return instanceIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        InstanceGroup that = (InstanceGroup) o;
        return min == that.min &&
                desired == that.desired &&
                max == that.max &&
                Objects.equals(id, that.id) &&
                Objects.equals(launchConfigurationName, that.launchConfigurationName) &&
                Objects.equals(tags, that.tags) &&
                Objects.equals(instanceIds, that.instanceIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, launchConfigurationName, min, desired, max, tags, instanceIds);
    }

    @Override
    public String toString() {
        return "InstanceGroup{" +
                "id='" + id + '\'' +
                ", launchConfigurationName='" + launchConfigurationName + '\'' +
                ", min=" + min +
                ", desired=" + desired +
                ", max=" + max +
                ", tags=" + tags +
                ", instanceIds=" + instanceIds +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String launchConfigurationName;
        private int min;
        private int desired;
        private int max;
        private Map<String, String> tags;
        private List<String> instanceIds;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withLaunchConfigurationName(String launchConfigurationName) {
            this.launchConfigurationName = launchConfigurationName;
            return this;
        }

        public Builder withMin(int min) {
            this.min = min;
            return this;
        }

        public Builder withDesired(int desired) {
            this.desired = desired;
            return this;
        }

        public Builder withMax(int max) {
            this.max = max;
            return this;
        }

        public Builder withTags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder withInstanceIds(List<String> instanceIds) {
            this.instanceIds = instanceIds;
            return this;
        }

        public InstanceGroup build() {
            return new InstanceGroup(id, launchConfigurationName, min, desired, max, tags, instanceIds);
        }
    }
}
