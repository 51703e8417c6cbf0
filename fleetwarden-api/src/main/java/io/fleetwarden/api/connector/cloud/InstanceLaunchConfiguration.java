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

import java.util.Objects;
import java.util.Optional;

/**
 * Template used by a scaling group to start new instances. A present spot price means the group requests spot
 * instances with that bid.
 */
public class InstanceLaunchConfiguration {

    private final String id;
    private final String instanceType;
    private final String imageId;
    private final Optional<Double> spotPrice;

    public InstanceLaunchConfiguration(String id, String instanceType, String imageId, Optional<Double> spotPrice) {
        this.id = id;
        this.instanceType = instanceType;
        this.imageId = imageId;
        this.spotPrice = spotPrice;
    }

    public String getId() {
        return id;
    }

    public String getInstanceType() {
        return instanceType;
    }

    public String getImageId() {
        return imageId;
    }

    public Optional<Double> getSpotPrice() {
        return spotPrice;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        InstanceLaunchConfiguration that = (InstanceLaunchConfiguration) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(instanceType, that.instanceType) &&
                Objects.equals(imageId, that.imageId) &&
                Objects.equals(spotPrice, that.spotPrice);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, instanceType, imageId, spotPrice);
    }

    @Override
    public String toString() {
        return "InstanceLaunchConfiguration{" +
                "id='" + id + '\'' +
                ", instanceType='" + instanceType + '\'' +
                ", imageId='" + imageId + '\'' +
                ", spotPrice=" + spotPrice.map(Object::toString).orElse("none") +
                '}';
    }
}
